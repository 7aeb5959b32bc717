package com.randomtable.engine.resolver;

import com.randomtable.engine.model.Template;

/** A resolved template and the collection it was found in. */
public final class TemplateResolution {
    public final Template template;
    public final String collectionId;

    public TemplateResolution(Template template, String collectionId) {
        this.template = template;
        this.collectionId = collectionId;
    }
}
