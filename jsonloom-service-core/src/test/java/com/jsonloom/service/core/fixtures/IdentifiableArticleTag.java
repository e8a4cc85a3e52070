package com.jsonloom.service.core.fixtures;

import com.jsonloom.core.resources.AbstractIdentifiable;
import com.jsonloom.core.resources.annotations.HasOne;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Join resource between {@link Article} and {@link Tag}. */
@Getter
@Setter
@NoArgsConstructor
public class IdentifiableArticleTag extends AbstractIdentifiable<Integer> {

    @HasOne
    private Article article;

    @HasOne
    private Tag tag;

    public IdentifiableArticleTag(Integer id, Article article, Tag tag) {
        setId(id);
        this.article = article;
        this.tag = tag;
        article.getArticleTags().add(this);
        tag.getArticleTags().add(this);
    }
}
