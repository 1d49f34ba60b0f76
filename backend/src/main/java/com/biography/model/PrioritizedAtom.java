package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 带优先级评分的原子
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrioritizedAtom {

    private NarrativeAtom atom;

    private double priorityScore;

    private double recencyScore;

    private double uniquenessScore;

    private boolean preserved;
}
