package tech.grantlens.platform.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;
import java.util.Objects;

/**
 * Tagged principal identity. A user and a role sharing a name are different principals.
 */
public record PrincipalRef(PrincipalKind kind, String name) implements Comparable<PrincipalRef> {

    private static final Comparator<PrincipalRef> ORDER =
        Comparator.comparing(PrincipalRef::kind).thenComparing(PrincipalRef::name);

    public PrincipalRef {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static PrincipalRef user(String name) {
        return new PrincipalRef(PrincipalKind.USER, name);
    }

    public static PrincipalRef role(String name) {
        return new PrincipalRef(PrincipalKind.ROLE, name);
    }

    @JsonIgnore
    public boolean isUser() {
        return kind == PrincipalKind.USER;
    }

    @Override
    public int compareTo(PrincipalRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return kind.wireName() + ":" + name;
    }
}
