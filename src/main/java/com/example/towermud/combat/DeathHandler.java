package com.example.towermud.combat;

import com.example.towermud.event.RespawnManager;
import com.example.towermud.model.AreaDefinition;
import com.example.towermud.model.Item;
import com.example.towermud.model.LevelUpInfo;
import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.persistence.BossTracker;
import com.example.towermud.persistence.ItemCatalog;
import com.example.towermud.util.Dice;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves deaths on both sides of a fight: rewards, loot, boss keys and
 * titles when a mobile dies, and the trip back to town when a player does.
 */
public class DeathHandler {
    private static final Logger logger = LoggerFactory.getLogger(DeathHandler.class);

    private final World world;
    private final SessionRegistry sessions;
    private final RespawnManager respawnManager;
    private final Dice dice;

    // Optional collaborators; steps that need them are skipped when absent
    private volatile ItemCatalog itemCatalog;
    private volatile BossTracker bossTracker;

    public DeathHandler(World world, SessionRegistry sessions, RespawnManager respawnManager, Dice dice) {
        this.world = world;
        this.sessions = sessions;
        this.respawnManager = respawnManager;
        this.dice = dice;
    }

    public void setItemCatalog(ItemCatalog itemCatalog) {
        this.itemCatalog = itemCatalog;
    }

    public void setBossTracker(BossTracker bossTracker) {
        this.bossTracker = bossTracker;
    }

    public ItemCatalog getItemCatalog() { return itemCatalog; }
    public BossTracker getBossTracker() { return bossTracker; }

    public static String bossKeyId(int floor) {
        return "boss_key_floor_" + floor;
    }

    public static String bossKeyName(int floor) {
        return "Boss Key (Floor " + floor + ")";
    }

    /**
     * Handle a mobile whose health just reached zero. Does nothing if the
     * mobile was already marked dead.
     */
    public void handleMobileDeath(Mobile mobile, Room room, long now) {
        if (mobile.getState() == MobileState.DEAD) {
            return;
        }
        // Attackers are captured in engagement order before combat state is wiped
        List<String> attackers = mobile.markDead();
        try {
            resolveRewards(mobile, room, attackers);
        } finally {
            room.removeMobile(mobile);
            respawnManager.enqueue(mobile, now);
        }
    }

    private void resolveRewards(Mobile mobile, Room room, List<String> attackers) {
        int count = attackers.size();

        RewardSplit xp = RewardSplit.of(mobile.getExperienceValue(), count);
        RewardSplit gold = RewardSplit.of(rollGold(mobile), count);

        logger.info("[DeathHandler] {} defeated in {} by [{}], xp={} ({} each), gold={} ({} each)",
            mobile.getName(), room.getId(), String.join(", ", attackers),
            xp.total(), xp.perShare(), gold.total(), gold.perShare());

        List<Player> online = new ArrayList<>();
        for (String name : attackers) {
            Player p = sessions.get(name);
            if (p == null) continue;    // Disconnected attackers forfeit their share
            online.add(p);
            try {
                rewardAttacker(p, mobile, xp, gold, count);
            } catch (RuntimeException e) {
                logger.warn("[DeathHandler] Failed to reward {} for {}: {}", p.getName(), mobile.getName(), e.getMessage(), e);
            }
        }

        try {
            dropLoot(mobile, room, online);
        } catch (RuntimeException e) {
            logger.warn("[DeathHandler] Loot skipped for {}: {}", mobile.getName(), e.getMessage(), e);
        }

        if (mobile.isBoss()) {
            dropBossKey(mobile, room, online);
            recordBossClear(mobile, online);
        }

        if (online.isEmpty()) {
            sessions.broadcastToRoom(room, String.format("%s is dead!\n", mobile.getName()));
        } else if (online.size() == 1) {
            sessions.broadcastToRoom(room, String.format("%s has slain %s!\n", online.get(0).getName(), mobile.getName()));
        } else {
            List<String> names = new ArrayList<>();
            for (Player p : online) names.add(p.getName());
            sessions.broadcastToRoom(room, String.format("%s have slain %s!\n", String.join(", ", names), mobile.getName()));
        }
    }

    private int rollGold(Mobile mobile) {
        ItemCatalog catalog = itemCatalog;
        if (catalog != null) {
            try {
                return catalog.rollGold(mobile);
            } catch (RuntimeException e) {
                logger.warn("[DeathHandler] Gold roll failed for {}: {}", mobile.getName(), e.getMessage(), e);
                return 0;
            }
        }
        return mobile.getGoldMax() <= 0 ? 0 : dice.between(mobile.getGoldMin(), mobile.getGoldMax());
    }

    private void rewardAttacker(Player p, Mobile mobile, RewardSplit xp, RewardSplit gold, int count) {
        p.endCombat();
        p.recordKill(mobile.getName());

        List<LevelUpInfo> levelUps = p.gainExperience(xp.perShare());
        if (count <= 1) {
            p.send(String.format("\nYou have slain %s!\n", mobile.getName()));
            p.send(String.format("You gain %d experience points.\n", xp.perShare()));
        } else {
            p.send(String.format("\nYour group has slain %s!\n", mobile.getName()));
            p.send(String.format("You gain %d experience points (split %d ways).\n", xp.perShare(), count));
        }
        for (LevelUpInfo lu : levelUps) {
            p.send("\n*** LEVEL UP! ***\n");
            p.send(String.format("You are now level %d!\n", lu.newLevel()));
            p.send(String.format("Max Health increased by %d (now %d)\n", lu.hpGain(), p.getHpMax()));
            p.send(String.format("Max Mana increased by %d (now %d)\n", lu.manaGain(), p.getMpMax()));
            p.send("You feel completely refreshed!\n");
        }
        if (!levelUps.isEmpty()) {
            logger.info("[DeathHandler] {} reached level {}", p.getName(), p.getLevel());
        }

        if (gold.total() > 0 && gold.perShare() > 0) {
            p.addGold(gold.perShare());
            if (count <= 1) {
                p.send(String.format("You loot %d gold.\n", gold.perShare()));
            } else {
                p.send(String.format("You loot %d gold (split %d ways).\n", gold.perShare(), count));
            }
        }
    }

    private void dropLoot(Mobile mobile, Room room, List<Player> online) {
        ItemCatalog catalog = itemCatalog;
        if (catalog == null) {
            return;
        }
        List<String> dropped = new ArrayList<>();
        for (String itemId : catalog.rollLoot(mobile)) {
            Optional<Item> item = catalog.findItem(itemId);
            if (item.isPresent()) {
                room.addItem(item.get().getName());
                dropped.add(item.get().getName());
            } else {
                logger.warn("[DeathHandler] Unknown item {} in loot table of {}", itemId, mobile.getTemplateKey());
            }
        }
        if (!dropped.isEmpty()) {
            String msg = String.format("%s dropped: %s\n", mobile.getName(), String.join(", ", dropped));
            for (Player p : online) p.send(msg);
        }
    }

    private void dropBossKey(Mobile mobile, Room room, List<Player> online) {
        int floor = mobile.getFloor();
        String keyName = bossKeyName(floor);
        room.addItem(keyName);
        for (Player p : online) {
            p.send(String.format("\n*** %s dropped a %s! ***\n", mobile.getName(), keyName));
        }
        logger.info("[DeathHandler] Boss key {} dropped by {} in {}", bossKeyId(floor), mobile.getName(), room.getId());
    }

    /**
     * Final-floor bosses record a clear per connected attacker. Tracker
     * failures are logged; the rest of the death still resolves.
     */
    private void recordBossClear(Mobile mobile, List<Player> online) {
        BossTracker tracker = bossTracker;
        AreaDefinition area = world.getArea(mobile.getAreaId());
        if (tracker == null || area == null || mobile.getFloor() != area.getFinalFloor()) {
            return;
        }
        boolean unlockedBefore = tracker.isFullyUnlocked();
        for (Player p : online) {
            try {
                boolean first = tracker.recordKill(area.getId(), p.getName());
                if (first) {
                    if (p.addTitle(area.getFirstClearTitle())) {
                        p.send(String.format("\nYou have earned the title '%s'!\n", area.getFirstClearTitle()));
                    }
                    sessions.broadcastAll(String.format("\n*** %s is the first to conquer %s and is now known as '%s'! ***\n",
                        p.getName(), area.getName(), area.getFirstClearTitle()));
                } else if (p.addTitle(area.getSharedTitle())) {
                    p.send(String.format("\nYou have earned the title '%s'!\n", area.getSharedTitle()));
                }
            } catch (SQLException | RuntimeException e) {
                logger.warn("[DeathHandler] Failed to record boss kill area={} player={}: {}",
                    area.getId(), p.getName(), e.getMessage(), e);
            }
        }
        if (!unlockedBefore && tracker.isFullyUnlocked()) {
            sessions.broadcastAll("\n*** Every tower has fallen. The way to the final ascent is open! ***\n");
        }
    }

    /**
     * Handle a player killed by a mobile: no item or gold loss, just a trip
     * back to the starting room at full health and mana.
     */
    public void handlePlayerDeath(Player player, Mobile killer, Room room) {
        logger.info("[DeathHandler] {} killed by {} in {}", player.getName(), killer.getName(), room.getId());

        player.recordDeath();
        player.endCombat();
        killer.disengage(player.getName());

        Room respawnRoom = world.getStartingRoom();
        String respawnName = respawnRoom != null ? respawnRoom.getName() : world.getStartingRoomId();

        player.send("\n\n*** YOU HAVE DIED ***\n");
        player.send(String.format("You will respawn at %s.\n\n", respawnName));

        sessions.broadcastToRoom(room, String.format("%s has been slain by %s!\n", player.getName(), killer.getName()),
            List.of(player.getName()));

        player.restoreFully();
        if (respawnRoom == null || !world.movePlayer(player, respawnRoom.getId())) {
            logger.warn("[DeathHandler] Starting room {} missing, {} stays in {}", world.getStartingRoomId(), player.getName(), room.getId());
            return;
        }
        player.send(respawnRoom.describe(player.getName()) + "\n");
    }
}
