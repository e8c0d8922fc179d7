package com.acl.ptree.util;

import com.acl.ptree.api.TreeListener;
import com.acl.ptree.api.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans {@link TreeListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeTreeListener<K> implements TreeListener<K> {
    private final List<TreeListener<K>> listeners = new ArrayList<>();

    public CompositeTreeListener<K> addForComposite(TreeListener<K> listener) {
        listeners.add(listener);
        return this;
    }

    @Override
    public void onNodeAdded(K id, Visibility visibility) {
        for (TreeListener<K> l : listeners)
            l.onNodeAdded(id, visibility);
    }

    @Override
    public void onTagAdded(K id, String tag) {
        for (TreeListener<K> l : listeners)
            l.onTagAdded(id, tag);
    }

    @Override
    public void onReparented(K id, K oldParentId, K newParentId) {
        for (TreeListener<K> l : listeners)
            l.onReparented(id, oldParentId, newParentId);
    }

    @Override
    public void onMadePrivate(K id) {
        for (TreeListener<K> l : listeners)
            l.onMadePrivate(id);
    }

    @Override
    public void onPropagated(K rootId, int visitedCount) {
        for (TreeListener<K> l : listeners)
            l.onPropagated(rootId, visitedCount);
    }
}
