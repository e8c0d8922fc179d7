package com.acl.ptree.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class VisibilityTest {

    @Test
    public void testJoinIsPrivateIfEitherSideIsPrivate() {
        assertEquals(Visibility.PUBLIC, Visibility.PUBLIC.join(Visibility.PUBLIC));
        assertEquals(Visibility.PRIVATE, Visibility.PUBLIC.join(Visibility.PRIVATE));
        assertEquals(Visibility.PRIVATE, Visibility.PRIVATE.join(Visibility.PUBLIC));
        assertEquals(Visibility.PRIVATE, Visibility.PRIVATE.join(Visibility.PRIVATE));
    }

    @Test
    public void testDisplayName() {
        assertEquals("Public", Visibility.PUBLIC.displayName());
        assertEquals("Private", Visibility.PRIVATE.displayName());
        assertTrue(Visibility.PRIVATE.isPrivate());
        assertFalse(Visibility.PUBLIC.isPrivate());
    }
}
