package com.depegscan.client.dto;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param items decoded items (malformed ones already dropped)
 * @param rawCount number of items the endpoint returned, before decoding
 * @param countTotal total reported by pageInfo, or -1 when absent
 */
public record Page<T>(List<T> items, int rawCount, int countTotal) {
}
