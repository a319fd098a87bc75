package lkml.watch.app.model;

import lkml.watch.app.entity.PatchCard;
import lombok.Value;

/**
 * Outcome of inserting a card: either this call created the row, or a concurrent writer got there first.
 */
@Value
public class CardCreationResult {
    Outcome outcome;
    PatchCard card;

    public enum Outcome {
        CREATED,
        ALREADY_EXISTS
    }

    public static CardCreationResult created(PatchCard card) {
        return new CardCreationResult(Outcome.CREATED, card);
    }

    public static CardCreationResult alreadyExists(PatchCard existing) {
        return new CardCreationResult(Outcome.ALREADY_EXISTS, existing);
    }

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }
}
