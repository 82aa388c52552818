package com.astrazeneca.fusac.data;

/**
 * Category of a paired molecule together with the strand tallies that produced it.
 */
public class Classification {
    public final HitCategory category;
    public final BaseTally forward;
    public final BaseTally reverse;

    public Classification(HitCategory category, BaseTally forward, BaseTally reverse) {
        this.category = category;
        this.forward = forward;
        this.reverse = reverse;
    }

    @Override
    public String toString() {
        return category + " forward=" + forward + " reverse=" + reverse;
    }
}
