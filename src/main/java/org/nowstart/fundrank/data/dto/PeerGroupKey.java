package org.nowstart.fundrank.data.dto;

import org.nowstart.fundrank.data.exception.InvalidInputException;

/**
 * Peer cohort used for ranking. A key without subcategory only matches funds that have no subcategory.
 */
public record PeerGroupKey(
        String category,
        String subcategory
) {

    public PeerGroupKey {
        if (category == null || category.isBlank()) {
            throw new InvalidInputException(InvalidInputException.INVALID_PEER_GROUP, "peer group category is required");
        }
        category = category.trim();
        subcategory = (subcategory == null || subcategory.isBlank()) ? null : subcategory.trim();
    }

    public static PeerGroupKey of(String category, String subcategory) {
        return new PeerGroupKey(category, subcategory);
    }

    public String label() {
        return subcategory == null ? category : category + "/" + subcategory;
    }
}
