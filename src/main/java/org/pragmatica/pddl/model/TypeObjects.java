package org.pragmatica.pddl.model;

import java.util.List;

/**
 * Objects or constants declared with one type.
 */
public record TypeObjects(String type, List<String> objects) {
    public TypeObjects {
        objects = List.copyOf(objects);
    }

    public boolean hasObject(String objectName) {
        return objects.stream()
                      .anyMatch(object -> object.equalsIgnoreCase(objectName));
    }
}
