package com.jsonloom.service.core.fixtures;

import com.jsonloom.core.resources.AbstractIdentifiable;
import com.jsonloom.core.resources.annotations.Attr;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class WorkTag extends AbstractIdentifiable<Integer> {

    @Attr
    private String text;

    @Attr
    private boolean isBuiltIn;

    public WorkTag(Integer id, String text) {
        setId(id);
        this.text = text;
    }
}
