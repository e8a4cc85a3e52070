package com.jsonloom.core.resources;

import com.jsonloom.core.errors.InvalidConfigurationException;
import com.jsonloom.core.resources.annotations.Attr;
import com.jsonloom.core.resources.annotations.HasMany;
import com.jsonloom.core.resources.annotations.HasOne;
import com.jsonloom.core.resources.annotations.JsonApiResource;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the immutable {@link ResourceGraph} from explicitly registered resource classes. Fields are
 * discovered through {@link Attr}, {@link HasOne} and {@link HasMany}; relationship targets must be
 * registered as well.
 */
@Slf4j
public class ResourceGraphBuilder {
    private final Map<Class<?>, String> registrations = new LinkedHashMap<>();

    public ResourceGraphBuilder add(Class<? extends Identifiable<?>> resourceClass) {
        return add(resourceClass, null);
    }

    public ResourceGraphBuilder add(Class<? extends Identifiable<?>> resourceClass, String publicName) {
        if (registrations.containsKey(resourceClass)) {
            log.debug("Resource class {} is already registered, skipping", resourceClass.getName());
            return this;
        }
        registrations.put(resourceClass, publicName != null ? publicName : defaultPublicName(resourceClass));
        return this;
    }

    public ResourceGraph build() {
        List<ResourceContext> contexts = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map.Entry<Class<?>, String> registration : registrations.entrySet()) {
            if (!names.add(registration.getValue())) {
                throw new InvalidConfigurationException(
                        "Resource type '" + registration.getValue() + "' is registered more than once.");
            }
            contexts.add(createContext(registration.getKey(), registration.getValue()));
        }

        DefaultResourceGraph graph = new DefaultResourceGraph(contexts);
        for (ResourceContext context : contexts) {
            for (RelationshipAttribute relationship : context.getRelationships()) {
                ResourceContext rightType = graph.findResourceContext(relationship.getRightClass())
                        .orElseThrow(() -> new InvalidConfigurationException("Relationship '"
                                + relationship.getPublicName() + "' on resource type '" + context.getPublicName()
                                + "' targets unregistered class '" + relationship.getRightClass().getName() + "'."));
                relationship.bind(context, rightType);
            }
        }

        log.info("Resource graph built with {} resource types", contexts.size());
        return graph;
    }

    private ResourceContext createContext(Class<?> resourceClass, String publicName) {
        List<AttrAttribute> attributes = new ArrayList<>();
        List<RelationshipAttribute> relationships = new ArrayList<>();
        Set<String> fieldNames = new HashSet<>();

        for (Field field : declaredFields(resourceClass)) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            if (field.isAnnotationPresent(Attr.class)) {
                Attr attr = field.getAnnotation(Attr.class);
                AttrAttribute attribute = new AttrAttribute(
                        nameOrDefault(attr.publicName(), field), field, Set.copyOf(Arrays.asList(attr.capabilities())));
                ensureUnique(fieldNames, attribute, publicName);
                attributes.add(attribute);
            } else if (field.isAnnotationPresent(HasOne.class)) {
                HasOne hasOne = field.getAnnotation(HasOne.class);
                HasOneAttribute relationship =
                        new HasOneAttribute(nameOrDefault(hasOne.publicName(), field), field, hasOne.canInclude());
                ensureUnique(fieldNames, relationship, publicName);
                relationships.add(relationship);
            } else if (field.isAnnotationPresent(HasMany.class)) {
                HasMany hasMany = field.getAnnotation(HasMany.class);
                HasManyAttribute relationship;
                try {
                    relationship = new HasManyAttribute(
                            nameOrDefault(hasMany.publicName(), field), field, hasMany.canInclude());
                } catch (IllegalArgumentException e) {
                    throw new InvalidConfigurationException(e.getMessage(), e);
                }
                ensureUnique(fieldNames, relationship, publicName);
                relationships.add(relationship);
            }
        }

        Class<?> identityClass = resolveIdentityClass(resourceClass);
        if (!RuntimeTypeConverter.isSupported(identityClass)) {
            throw new InvalidConfigurationException("Identifier type '" + identityClass.getName()
                    + "' of resource type '" + publicName + "' is not supported.");
        }
        log.debug(
                "Registered resource type '{}' ({} attributes, {} relationships)",
                publicName,
                attributes.size(),
                relationships.size());
        return new ResourceContext(publicName, resourceClass, identityClass, attributes, relationships);
    }

    private static void ensureUnique(Set<String> fieldNames, ResourceFieldAttribute field, String resourceName) {
        if ("id".equals(field.getPublicName()) || "type".equals(field.getPublicName())) {
            throw new InvalidConfigurationException("Field name '" + field.getPublicName() + "' on resource type '"
                    + resourceName + "' is reserved.");
        }
        if (!fieldNames.add(field.getPublicName())) {
            throw new InvalidConfigurationException("Field '" + field.getPublicName()
                    + "' is defined more than once on resource type '" + resourceName + "'.");
        }
    }

    private static String nameOrDefault(String publicName, Field field) {
        return publicName.isEmpty() ? field.getName() : publicName;
    }

    private static List<Field> declaredFields(Class<?> resourceClass) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> type = resourceClass; type != null && type != Object.class; type = type.getSuperclass()) {
            hierarchy.push(type);
        }
        List<Field> fields = new ArrayList<>();
        hierarchy.forEach(type -> fields.addAll(Arrays.asList(type.getDeclaredFields())));
        return fields;
    }

    static String defaultPublicName(Class<?> resourceClass) {
        JsonApiResource annotation = resourceClass.getAnnotation(JsonApiResource.class);
        if (annotation != null && !annotation.publicName().isEmpty()) {
            return annotation.publicName();
        }
        String simple = resourceClass.getSimpleName();
        String camel = Character.toLowerCase(simple.charAt(0)) + simple.substring(1);
        if (camel.endsWith("y") && camel.length() > 1 && "aeiou".indexOf(camel.charAt(camel.length() - 2)) < 0) {
            return camel.substring(0, camel.length() - 1) + "ies";
        }
        if (camel.endsWith("s") || camel.endsWith("x") || camel.endsWith("ch") || camel.endsWith("sh")) {
            return camel + "es";
        }
        return camel + "s";
    }

    private static Class<?> resolveIdentityClass(Class<?> resourceClass) {
        for (Class<?> type = resourceClass; type != null && type != Object.class; type = type.getSuperclass()) {
            Class<?> fromSuperclass = identifierArgument(type.getGenericSuperclass());
            if (fromSuperclass != null) {
                return fromSuperclass;
            }
            for (Type genericInterface : type.getGenericInterfaces()) {
                Class<?> fromInterface = identifierArgument(genericInterface);
                if (fromInterface != null) {
                    return fromInterface;
                }
            }
        }
        throw new InvalidConfigurationException("Cannot determine the identifier type of resource class '"
                + resourceClass.getName() + "'. Implement Identifiable<ID> with a concrete ID type.");
    }

    private static Class<?> identifierArgument(Type type) {
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Identifiable.class.isAssignableFrom(raw)
                && parameterized.getActualTypeArguments().length == 1
                && parameterized.getActualTypeArguments()[0] instanceof Class<?> argument) {
            return argument;
        }
        return null;
    }
}
