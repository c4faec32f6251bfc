package org.pragmatica.pddl.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Constants of a domain or objects of a problem grouped by type. Lookups ignore case.
 */
public final class TypeObjectMap {
    private static final TypeObjectMap EMPTY = new TypeObjectMap(Map.of(), Map.of());

    private final Map<String, TypeObjects> byType;
    private final Map<String, TypeObjects> byObject;

    private TypeObjectMap(Map<String, TypeObjects> byType, Map<String, TypeObjects> byObject) {
        this.byType = byType;
        this.byObject = byObject;
    }

    public static TypeObjectMap empty() {
        return EMPTY;
    }

    /**
     * Group the vertices of an object declaration graph by their parent. Objects declared without a type are
     * listed under {@value InheritanceGraph#OBJECT}.
     */
    public static TypeObjectMap from(InheritanceGraph declarations) {
        var grouped = new LinkedHashMap<String, List<String>>();
        for (var object : declarations.vertices()) {
            var types = declarations.parentsOf(object);
            if (types.isEmpty()) {
                if (declarations.childrenOf(object)
                                .isEmpty()) {
                    grouped.computeIfAbsent(InheritanceGraph.OBJECT, key -> new ArrayList<>())
                           .add(object);
                }
                continue;
            }
            types.forEach(type -> grouped.computeIfAbsent(type, key -> new ArrayList<>())
                                         .add(object));
        }
        var byType = new LinkedHashMap<String, TypeObjects>();
        var byObject = new LinkedHashMap<String, TypeObjects>();
        grouped.forEach((type, objects) -> {
            var typeObjects = new TypeObjects(type, objects);
            byType.put(key(type), typeObjects);
            objects.forEach(object -> byObject.putIfAbsent(key(object), typeObjects));
        });
        return new TypeObjectMap(byType, byObject);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public List<TypeObjects> types() {
        return List.copyOf(byType.values());
    }

    public Optional<TypeObjects> type(String type) {
        return Optional.ofNullable(byType.get(key(type)));
    }

    public List<String> objectsOf(String type) {
        return type(type).map(TypeObjects::objects)
                         .orElse(List.of());
    }

    public Optional<String> typeOf(String objectName) {
        return Optional.ofNullable(byObject.get(key(objectName)))
                       .map(TypeObjects::type);
    }

    public int size() {
        return byType.size();
    }

    public boolean isEmpty() {
        return byType.isEmpty();
    }

    @Override
    public String toString() {
        return "TypeObjectMap" + types();
    }
}
