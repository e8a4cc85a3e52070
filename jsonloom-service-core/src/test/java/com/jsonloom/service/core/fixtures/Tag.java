package com.jsonloom.service.core.fixtures;

import com.jsonloom.core.resources.AbstractIdentifiable;
import com.jsonloom.core.resources.annotations.Attr;
import com.jsonloom.core.resources.annotations.HasMany;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class Tag extends AbstractIdentifiable<Integer> {

    @Attr
    private String name;

    @HasMany
    private Set<IdentifiableArticleTag> articleTags = new LinkedHashSet<>();

    public Tag(Integer id, String name) {
        setId(id);
        this.name = name;
    }
}
