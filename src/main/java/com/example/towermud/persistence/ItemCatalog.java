package com.example.towermud.persistence;

import com.example.towermud.model.Item;
import com.example.towermud.model.Mobile;

import java.util.List;
import java.util.Optional;

/**
 * Item definitions and the loot rolls made against them.
 */
public interface ItemCatalog {

    Optional<Item> findItem(String itemId);

    /**
     * Roll a mobile's loot table.
     * @return ids of the items that dropped, in loot-table order
     */
    List<String> rollLoot(Mobile mobile);

    /** Gold dropped by a mobile, within its configured range. */
    int rollGold(Mobile mobile);
}
