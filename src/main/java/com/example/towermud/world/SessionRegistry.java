package com.example.towermud.world;

import com.example.towermud.model.Player;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Connected players, keyed by lower-cased name. Lookups and broadcasts take
 * the read lock; login and logout take the write lock.
 */
public class SessionRegistry {

    private final Map<String, Player> players = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase();
    }

    /**
     * @return false if a player with that name is already connected
     */
    public boolean register(Player player) {
        lock.writeLock().lock();
        try {
            return players.putIfAbsent(key(player.getName()), player) == null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Player remove(String name) {
        lock.writeLock().lock();
        try {
            return players.remove(key(name));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return the connected player, or null */
    public Player get(String name) {
        lock.readLock().lock();
        try {
            return players.get(key(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isOnline(String name) {
        return get(name) != null;
    }

    /** Copy of the connected players, in login order. */
    public List<Player> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(players.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getOnlineCount() {
        lock.readLock().lock();
        try {
            return players.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Best-effort message to one player; silently dropped if they are offline. */
    public void sendToPlayer(String name, String text) {
        Player p = get(name);
        if (p != null) {
            p.send(text);
        }
    }

    /** Message every connected player standing in the room, minus the excluded names. */
    public void broadcastToRoom(Room room, String text, Collection<String> exclude) {
        if (room == null) return;
        Set<String> names = room.getPlayerNames();
        lock.readLock().lock();
        try {
            for (String name : names) {
                if (exclude != null && exclude.contains(name)) continue;
                Player p = players.get(key(name));
                if (p != null) p.send(text);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    public void broadcastToRoom(Room room, String text) {
        broadcastToRoom(room, text, null);
    }

    /** Server-wide announcement. */
    public void broadcastAll(String text) {
        for (Player p : snapshot()) {
            p.send(text);
        }
    }
}
