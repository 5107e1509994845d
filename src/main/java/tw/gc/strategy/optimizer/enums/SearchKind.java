package tw.gc.strategy.optimizer.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Search algorithm used by an optimization run.
 * The JSON value is also the search-kind segment of generated run ids.
 */
public enum SearchKind {
    GRID("grid"),
    WALK_FORWARD("walk_forward"),
    ADAPTIVE("adaptive");

    private final String code;

    SearchKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SearchKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Search kind cannot be null");
        }
        for (SearchKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code) || kind.name().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown search kind: " + code);
    }
}
