package com.trustgate.common.skill;

import com.trustgate.common.model.TrustCategory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/** Aligns free text (payload key {@code text}) with trust categories. */
public record CategorizerSkill(
    String name,
    String permission,
    Function<String, List<TrustCategory>> categorizer
) implements Skill {

    public CategorizerSkill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(categorizer, "categorizer");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.categorizer(this);
    }
}
