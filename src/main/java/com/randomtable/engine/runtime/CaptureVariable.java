package com.randomtable.engine.runtime;

import java.util.Collections;
import java.util.List;

/** Ordered results of {@code N*table >> $name}. */
public final class CaptureVariable {
    public final List<CaptureItem> items;
    public final int count;

    public CaptureVariable(List<CaptureItem> items) {
        this.items = Collections.unmodifiableList(items);
        this.count = items.size();
    }
}
