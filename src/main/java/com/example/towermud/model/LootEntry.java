package com.example.towermud.model;

/**
 * An item that can drop from a mobile with a percentage chance (0-100).
 */
public record LootEntry(String itemId, double dropChance) {
}
