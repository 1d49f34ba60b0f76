package com.biography.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 叙事图的边
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeEdge {

    private String fromAtomId;

    private String toAtomId;

    private Relation relation;

    /**
     * 权重 0-1
     */
    private double weight;

    public enum Relation {
        TEMPORAL("temporal"),
        THEMATIC("thematic"),
        RELATIONAL("relational");

        private final String code;

        Relation(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }
}
