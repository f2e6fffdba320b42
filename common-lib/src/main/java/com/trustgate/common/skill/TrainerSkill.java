package com.trustgate.common.skill;

import com.trustgate.common.model.TrustCategory;

import java.util.List;
import java.util.Objects;

/** Feeds labelled examples (payload keys {@code text}, {@code categories}) to a learner. */
public record TrainerSkill(
    String name,
    String permission,
    Trainer trainer
) implements Skill {

    public TrainerSkill {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(trainer, "trainer");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.trainer(this);
    }

    @FunctionalInterface
    public interface Trainer {
        /** @return number of new associations learned */
        int train(String example, List<TrustCategory> labels);
    }
}
