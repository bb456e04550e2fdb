package io.troupe.core.report;

/** Letter grade of an overall score. */
public enum Grade {
    A(90.0),
    B(80.0),
    C(70.0),
    D(60.0),
    F(0.0);

    private final double minScore;

    Grade(double minScore) {
        this.minScore = minScore;
    }

    public double minScore() {
        return minScore;
    }

    /**
     * Maps a score to its grade. Boundaries belong to the higher grade: {@code 90.0} is an A.
     *
     * @param score overall score, nominally 0-100
     * @return grade, never null
     */
    public static Grade fromScore(double score) {
        for (Grade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        return F;
    }
}
