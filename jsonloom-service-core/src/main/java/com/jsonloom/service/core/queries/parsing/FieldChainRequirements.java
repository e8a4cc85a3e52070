package com.jsonloom.service.core.queries.parsing;

/** What a field chain in a given position must look like. */
public enum FieldChainRequirements {
    /** Zero or more to-one relationships, then an attribute. */
    ENDS_IN_ATTRIBUTE,
    /** Zero or more to-one relationships, then an attribute or a to-one relationship. */
    ENDS_IN_ATTRIBUTE_OR_TO_ONE,
    /** Zero or more to-one relationships, then a to-many relationship. */
    ENDS_IN_TO_MANY,
    /** Relationships only, of any cardinality. */
    IS_RELATIONSHIP
}
