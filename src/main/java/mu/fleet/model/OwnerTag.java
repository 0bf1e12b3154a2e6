package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Who a machine belongs to, parsed once from the free-text note of a roster line.
 * {@code name} is present for MEMBER, VISITOR and STUDENT only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OwnerTag(
        @JsonProperty("kind") Kind kind,
        @JsonProperty("name") String name) {

    public static final String RESERVATION_NOTE = "Reservation Required";
    private static final String STUDENT_SUFFIX = "(Student)";
    private static final String VISITOR_SUFFIX = "(Visitor)";

    public enum Kind {
        MEMBER,
        VISITOR,
        STUDENT,
        RESERVED,
        UNOWNED
    }

    private static final OwnerTag RESERVED = new OwnerTag(Kind.RESERVED, null);
    private static final OwnerTag UNOWNED = new OwnerTag(Kind.UNOWNED, null);

    public OwnerTag {
        Objects.requireNonNull(kind, "kind is required");
        boolean named = kind == Kind.MEMBER || kind == Kind.VISITOR || kind == Kind.STUDENT;
        if (named && (name == null || name.isBlank())) {
            throw new IllegalArgumentException(kind + " owner requires a name");
        }
        if (!named && name != null) {
            throw new IllegalArgumentException(kind + " owner has no name");
        }
    }

    public static OwnerTag member(String name) {
        return new OwnerTag(Kind.MEMBER, name);
    }

    public static OwnerTag visitor(String name) {
        return new OwnerTag(Kind.VISITOR, name);
    }

    public static OwnerTag student(String name) {
        return new OwnerTag(Kind.STUDENT, name);
    }

    public static OwnerTag reserved() {
        return RESERVED;
    }

    public static OwnerTag unowned() {
        return UNOWNED;
    }

    /**
     * Parse an owner note.
     *
     * <pre>
     *   ""                      -> UNOWNED
     *   "Reservation Required"  -> RESERVED
     *   "Ann (Student)"         -> STUDENT("Ann")
     *   "Bo (Visitor)"          -> VISITOR("Bo")
     *   "Carla"                 -> MEMBER("Carla")
     * </pre>
     *
     * Never fails: a marker without a name in front of it yields UNOWNED.
     */
    public static OwnerTag parse(String note) {
        if (note == null) {
            return UNOWNED;
        }
        String s = note.trim();
        if (s.isEmpty()) {
            return UNOWNED;
        }
        if (s.equals(RESERVATION_NOTE)) {
            return RESERVED;
        }
        if (s.endsWith(STUDENT_SUFFIX)) {
            return named(Kind.STUDENT, s.substring(0, s.length() - STUDENT_SUFFIX.length()));
        }
        if (s.endsWith(VISITOR_SUFFIX)) {
            return named(Kind.VISITOR, s.substring(0, s.length() - VISITOR_SUFFIX.length()));
        }
        return member(s);
    }

    private static OwnerTag named(Kind kind, String rawName) {
        String name = rawName.trim();
        return name.isEmpty() ? UNOWNED : new OwnerTag(kind, name);
    }

    /** The owner's name, if this kind of owner has one. */
    @JsonIgnore
    public Optional<String> ownerName() {
        return Optional.ofNullable(name);
    }

    /** Short mark shown in front of the name: "s" for students, "v" for visitors. */
    @JsonIgnore
    public String mark() {
        return switch (kind) {
            case STUDENT -> "s";
            case VISITOR -> "v";
            default -> "";
        };
    }

    /** Text shown in the owner column. */
    @JsonIgnore
    public String displayName() {
        return switch (kind) {
            case MEMBER, VISITOR, STUDENT -> name;
            case RESERVED -> "Reservation required";
            case UNOWNED -> "";
        };
    }
}
