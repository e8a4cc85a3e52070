package com.jsonloom.service.core.fixtures;

import com.jsonloom.core.resources.AbstractIdentifiable;
import com.jsonloom.core.resources.annotations.Attr;
import com.jsonloom.core.resources.annotations.AttrCapabilities;
import com.jsonloom.core.resources.annotations.HasMany;
import com.jsonloom.core.resources.annotations.HasOne;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class WorkItem extends AbstractIdentifiable<Integer> {

    @Attr
    private String description;

    @Attr
    private WorkItemPriority priority;

    @Attr
    private Long durationInHours;

    @Attr(capabilities = {AttrCapabilities.ALLOW_VIEW, AttrCapabilities.ALLOW_CREATE})
    private boolean archived;

    @HasOne
    private UserAccount assignee;

    @HasMany
    private Set<UserAccount> subscribers = new LinkedHashSet<>();

    @HasMany
    private List<WorkTag> tags = new ArrayList<>();

    @HasOne
    private WorkItem parent;

    @HasMany(canInclude = false)
    private List<WorkItem> children = new ArrayList<>();

    public WorkItem(Integer id, String description) {
        setId(id);
        this.description = description;
    }
}
