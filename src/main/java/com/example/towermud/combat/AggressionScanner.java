package com.example.towermud.combat;

import com.example.towermud.model.Mobile;
import com.example.towermud.model.Player;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Starts fights between aggressive mobiles and the players who walk into
 * their rooms. At most one mobile jumps a given player per scan.
 */
public class AggressionScanner {
    private static final Logger logger = LoggerFactory.getLogger(AggressionScanner.class);

    private final World world;
    private final SessionRegistry sessions;

    // Pilgrim mode: no mobile ever starts a fight
    private volatile boolean pilgrimMode;

    public AggressionScanner(World world, SessionRegistry sessions, boolean pilgrimMode) {
        this.world = world;
        this.sessions = sessions;
        this.pilgrimMode = pilgrimMode;
    }

    public boolean isPilgrimMode() {
        return pilgrimMode;
    }

    public void setPilgrimMode(boolean pilgrimMode) {
        this.pilgrimMode = pilgrimMode;
    }

    /**
     * Check the player's room for an aggressive, idle mobile and start a
     * fight with the first one found.
     * @return the mobile that attacked, or null
     */
    public Mobile scan(Player p) {
        if (pilgrimMode) return null;
        if (p.isInCombat() || !p.isAlive()) return null;

        Room room = world.getRoom(p.getCurrentRoom());
        if (room == null) {
            logger.debug("[AggressionScanner] {} is in unknown room {}", p.getName(), p.getCurrentRoom());
            return null;
        }

        for (Mobile m : room.getMobiles()) {
            if (!m.isAggressive() || !m.isIdle()) continue;

            p.startCombat(m.getName());
            m.engage(p.getName());

            p.send(String.format("\n%s attacks you!\n", m.getName()));
            sessions.broadcastToRoom(room, String.format("%s attacks %s!\n", m.getName(), p.getName()), List.of(p.getName()));
            logger.debug("[AggressionScanner] {} attacked {} in {}", m.getName(), p.getName(), room.getId());
            return m;
        }
        return null;
    }
}
