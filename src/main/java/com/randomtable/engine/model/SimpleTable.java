package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.List;

public class SimpleTable extends Table {
    public List<Entry> entries = new ArrayList<>();

    @Override
    public String type() {
        return "simple";
    }
}
