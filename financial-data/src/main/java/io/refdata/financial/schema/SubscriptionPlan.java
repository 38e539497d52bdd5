package io.refdata.financial.schema;

import java.util.Locale;

/** Subscription tiers, cheapest first; a higher tier sees every column of the lower ones. */
public enum SubscriptionPlan {
    LIGHT,
    STANDARD,
    PREMIUM;

    public boolean includes(SubscriptionPlan required) {
        return compareTo(required) >= 0;
    }

    public static SubscriptionPlan of(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
