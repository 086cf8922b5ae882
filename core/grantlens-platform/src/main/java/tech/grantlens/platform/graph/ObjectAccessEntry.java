package tech.grantlens.platform.graph;

import tech.grantlens.platform.snapshot.PrincipalKind;

import java.util.List;

/**
 * One principal with access to a database object.
 *
 * @param name principal name
 * @param entityType user or role
 * @param accessTypes sorted union of the access types held on the object
 * @param source comma-separated, sorted names of the principals the privileges were granted to
 */
public record ObjectAccessEntry(String name, PrincipalKind entityType, List<String> accessTypes, String source) {

    public ObjectAccessEntry {
        accessTypes = List.copyOf(accessTypes);
    }
}
