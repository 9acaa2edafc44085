package com.mouse.smartbet.model;

import com.mouse.smartbet.enums.Outcome;

/**
 * Class probabilities in canonical order (home, away, draw).
 */
public record ProbabilityTriple(double home, double away, double draw) {

    public static ProbabilityTriple of(double home, double away, double draw) {
        return new ProbabilityTriple(home, away, draw);
    }

    public double get(Outcome outcome) {
        return switch (outcome) {
            case HOME -> home;
            case AWAY -> away;
            case DRAW -> draw;
        };
    }

    public double sum() {
        return home + away + draw;
    }

    public boolean isFinite() {
        return Double.isFinite(home) && Double.isFinite(away) && Double.isFinite(draw);
    }

    public boolean hasNegative() {
        return home < 0 || away < 0 || draw < 0;
    }

    /** Arg-max with ties broken by {@link Outcome#PRIORITY}. */
    public Outcome argMax() {
        Outcome best = Outcome.PRIORITY.get(0);
        for (Outcome o : Outcome.PRIORITY) {
            if (get(o) > get(best)) {
                best = o;
            }
        }
        return best;
    }

    public double max() {
        return get(argMax());
    }

    public ProbabilityTriple normalized() {
        double s = sum();
        return new ProbabilityTriple(home / s, away / s, draw / s);
    }

    public double[] toArray() {
        return new double[]{home, away, draw};
    }
}
