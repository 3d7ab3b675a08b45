package com.example.towermud.model;

/**
 * One level gained by a player.
 */
public record LevelUpInfo(int newLevel, int hpGain, int manaGain) {
}
