package com.example.towermud.combat;

import com.example.towermud.model.Mobile;
import com.example.towermud.model.MobileState;
import com.example.towermud.model.Player;
import com.example.towermud.util.Dice;
import com.example.towermud.util.TickService;
import com.example.towermud.world.Direction;
import com.example.towermud.world.Room;
import com.example.towermud.world.SessionRegistry;
import com.example.towermud.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Runs the combat round. Every tick:
 * <ol>
 *   <li>snapshot the connected players;</li>
 *   <li>each player in combat attacks their target once;</li>
 *   <li>each mobile in combat attacks (or flees) once;</li>
 *   <li>aggressive mobiles look for new victims.</li>
 * </ol>
 * Every player attack of a round lands before any mobile attack, so a
 * killing blow always denies the mobile its swing that round.
 */
public class CombatManager {
    private static final Logger logger = LoggerFactory.getLogger(CombatManager.class);

    public static final long DEFAULT_TICK_MS = 3000;
    public static final double DEFAULT_FLEE_CHANCE = 0.35;

    private final World world;
    private final SessionRegistry sessions;
    private final CombatCalculator calculator;
    private final DeathHandler deathHandler;
    private final AggressionScanner aggressionScanner;
    private final Dice dice;
    private final long tickMs;
    private final double fleeChance;

    private final TickService tickService = new TickService("combat");
    private final AtomicBoolean running = new AtomicBoolean(false);
    private LongSupplier clock = System::currentTimeMillis;

    public CombatManager(World world, SessionRegistry sessions, CombatCalculator calculator,
                         DeathHandler deathHandler, AggressionScanner aggressionScanner,
                         Dice dice, long tickMs, double fleeChance) {
        this.world = world;
        this.sessions = sessions;
        this.calculator = calculator;
        this.deathHandler = deathHandler;
        this.aggressionScanner = aggressionScanner;
        this.dice = dice;
        this.tickMs = tickMs;
        this.fleeChance = fleeChance;
    }

    /** Replace the time source (tests). */
    public void setClock(LongSupplier clock) {
        this.clock = clock;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        tickService.scheduleAtFixedRate("combat-tick", this::tick, tickMs, tickMs);
        logger.info("[CombatManager] Initialized with {}ms combat rounds", tickMs);
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        tickService.shutdown();
        logger.info("[CombatManager] Stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void tick() {
        if (!running.get()) return;
        try {
            processRound(clock.getAsLong());
        } catch (RuntimeException e) {
            logger.warn("[CombatManager] Error during combat tick: {}", e.getMessage(), e);
        }
    }

    /**
     * One full combat round at the given time.
     */
    public void processRound(long now) {
        List<Player> players = sessions.snapshot();

        for (Player p : players) {
            try {
                resolvePlayerAttack(p, now);
            } catch (RuntimeException e) {
                logger.warn("[CombatManager] Player attack failed player={} room={}: {}",
                    p.getName(), p.getCurrentRoom(), e.getMessage(), e);
            }
        }

        processMobileAttacks(now);

        for (Player p : players) {
            try {
                aggressionScanner.scan(p);
            } catch (RuntimeException e) {
                logger.warn("[CombatManager] Aggression check failed player={} room={}: {}",
                    p.getName(), p.getCurrentRoom(), e.getMessage(), e);
            }
        }
    }

    // ==================== PLAYER ATTACKS ====================

    /**
     * Resolve one attack by a player against their combat target.
     * @return the outcome, or null when the player is not fighting
     */
    public CombatResult resolvePlayerAttack(Player p, long now) {
        if (!p.isInCombat() || !p.isAlive()) {
            return null;
        }
        String targetName = p.getCombatTarget();
        Room room = world.getRoom(p.getCurrentRoom());
        Mobile mob = room == null ? null : room.findMobileFor(p.getName(), targetName);
        if (mob == null) {
            logger.debug("[CombatManager] Combat target vanished player={} target={} room={}",
                p.getName(), targetName, p.getCurrentRoom());
            p.endCombat();
            p.send("\nYour opponent has vanished!\n");
            return CombatResult.vanished(p.getName(), targetName);
        }
        if (!mob.isEngagedWith(p.getName())) {
            mob.engage(p.getName());
        }

        CombatCalculator.AttackRoll roll = calculator.rollAttack(p);
        int ac = mob.getArmorClass();
        String verb = CombatCalculator.attackVerb(p);
        String verbThird = CombatCalculator.attackVerbThirdPerson(p);

        if (!CombatCalculator.isHit(roll.total(), ac)) {
            p.send(String.format("\nYou %s %s... (%s vs AC %d) Miss!\n", verb, mob.getName(), roll.breakdown(), ac));
            notifyOtherFighters(mob, p.getName(),
                String.format("\n%s %s %s and misses!\n", p.getName(), verbThird, mob.getName()));
            return CombatResult.miss(p.getName(), mob.getName()).withRoll(roll.total(), ac);
        }

        boolean sneakAttack = mob.isSneakAttackEligible(p.getName());
        int damage = calculator.rollDamageAgainst(p, mob, sneakAttack);
        int taken = mob.takeDamage(damage);
        mob.addThreat(p.getName(), taken);
        p.recordDamageDealt(taken);

        logger.debug("[CombatManager] {} hit {} for {} (sneak={}) hp={}/{}",
            p.getName(), mob.getName(), taken, sneakAttack, mob.getHpCur(), mob.getHpMax());

        p.send(String.format("\nYou %s %s... (%s vs AC %d) Hit!\nYou deal %d damage! (%d/%d HP)\n",
            verb, mob.getName(), roll.breakdown(), ac, taken, mob.getHpCur(), mob.getHpMax()));
        notifyOtherFighters(mob, p.getName(),
            String.format("\n%s hits %s for %d damage! (%d/%d HP)\n",
                p.getName(), mob.getName(), taken, mob.getHpCur(), mob.getHpMax()));

        if (mob.getHpCur() <= 0) {
            deathHandler.handleMobileDeath(mob, room, now);
            return CombatResult.death(p.getName(), mob.getName(), taken).withRoll(roll.total(), ac).withSneakAttack(sneakAttack);
        }
        return CombatResult.hit(p.getName(), mob.getName(), taken).withRoll(roll.total(), ac).withSneakAttack(sneakAttack);
    }

    private void notifyOtherFighters(Mobile mob, String except, String message) {
        for (String name : mob.getAttackers()) {
            if (name.equals(except)) continue;
            sessions.sendToPlayer(name, message);
        }
    }

    // ==================== MOBILE ATTACKS ====================

    private void processMobileAttacks(long now) {
        for (Room room : world.getRooms()) {
            for (Mobile mob : room.getMobiles()) {
                if (!mob.isInCombat()) continue;
                try {
                    resolveMobileAttack(mob, room, now);
                } catch (RuntimeException e) {
                    logger.warn("[CombatManager] Mobile attack failed mobile={} room={}: {}",
                        mob, room.getId(), e.getMessage(), e);
                }
            }
        }
    }

    /**
     * Resolve one round for a mobile in combat: flee, retarget, or attack.
     * @return the outcome, or null when the mobile is not fighting
     */
    public CombatResult resolveMobileAttack(Mobile mob, Room room, long now) {
        if (!mob.isInCombat() || !mob.isAlive()) {
            return null;
        }
        if (mob.isStunned(now)) {
            return CombatResult.skipped(mob.getName());
        }

        if (mob.shouldFlee(dice, fleeChance, now)) {
            CombatResult fled = fleeMobile(mob, room);
            if (fled != null) return fled;
        }

        String targetName = mob.highestThreatTarget().orElse(null);
        if (targetName == null) {
            mob.disengageAll();
            return CombatResult.skipped(mob.getName());
        }

        Player target = sessions.get(targetName);
        if (target == null || !target.isAlive()) {
            mob.disengage(targetName);
            return CombatResult.skipped(mob.getName());
        }
        if (!room.getId().equals(target.getCurrentRoom())) {
            logger.debug("[CombatManager] Combat target left room mobile={} target={} mobRoom={} targetRoom={}",
                mob.getName(), targetName, room.getId(), target.getCurrentRoom());
            mob.disengage(targetName);
            endPlayerCombatWith(target, mob);
            return CombatResult.skipped(mob.getName());
        }

        int damage = mob.rollDamage(dice);
        int taken = target.takeDamage(damage);

        for (String fighterName : mob.getAttackers()) {
            Player fighter = sessions.get(fighterName);
            if (fighter == null) continue;
            if (fighter == target) {
                fighter.send(String.format("%s hits you for %d damage! (%d/%d HP)\n",
                    mob.getName(), taken, target.getHpCur(), target.getHpMax()));
            } else {
                fighter.send(String.format("%s hits %s for %d damage!\n", mob.getName(), targetName, taken));
            }
        }

        if (!target.isAlive()) {
            deathHandler.handlePlayerDeath(target, mob, room);
            return CombatResult.death(mob.getName(), targetName, taken);
        }
        return CombatResult.hit(mob.getName(), targetName, taken);
    }

    /**
     * Send a mobile running through a random exit on its own floor. Every
     * attacker's fight ends.
     * @return the outcome, or null when there is nowhere to run and the mobile fights on
     */
    private CombatResult fleeMobile(Mobile mob, Room room) {
        List<String> exits = new ArrayList<>();
        for (String roomId : room.getHorizontalExits()) {
            if (world.getRoom(roomId) != null) exits.add(roomId);
        }
        if (exits.isEmpty()) {
            sessions.broadcastToRoom(room, mob.getName() + " panics but has nowhere to run!\n");
            return null;
        }

        String dest = exits.get(dice.random().nextInt(exits.size()));
        List<String> attackers = mob.startFleeing();
        for (String name : attackers) {
            Player p = sessions.get(name);
            if (p != null) endPlayerCombatWith(p, mob);
        }

        sessions.broadcastToRoom(room, mob.getName() + " flees in terror!\n");
        world.moveMobile(mob, dest);
        sessions.broadcastToRoom(world.getRoom(dest), mob.getName() + " arrives, looking panicked.\n");
        logger.debug("[CombatManager] {} fled from {} to {}", mob.getName(), room.getId(), dest);
        return CombatResult.flee(mob.getName(), dest);
    }

    private static void endPlayerCombatWith(Player p, Mobile mob) {
        if (p.getCombatTarget().equalsIgnoreCase(mob.getName())) {
            p.endCombat();
        }
    }

    // ==================== PLAYER COMMANDS ====================

    /**
     * Start (or join) a fight with a mobile in the player's room.
     * @return true if the player is now fighting it
     */
    public boolean playerAttack(Player p, String mobileName) {
        if (aggressionScanner.isPilgrimMode()) {
            p.send("A sense of peace fills the land. You cannot fight here.\n");
            return false;
        }
        if (!p.isAlive()) {
            return false;
        }
        if (p.isInCombat()) {
            p.send(String.format("You are already fighting %s!\n", p.getCombatTarget()));
            return false;
        }
        Room room = world.getRoom(p.getCurrentRoom());
        Mobile mob = room == null ? null : room.findMobile(mobileName);
        if (mob == null) {
            p.send(String.format("You don't see '%s' here.\n", mobileName));
            return false;
        }
        if (!mob.isAttackable()) {
            p.send(String.format("You cannot attack %s.\n", mob.getName()));
            return false;
        }

        boolean joining = mob.getState() == MobileState.IN_COMBAT && !mob.getAttackers().isEmpty();
        mob.engage(p.getName());
        p.startCombat(mob.getName());

        if (joining) {
            p.send(String.format("You join the fight against %s!\n", mob.getName()));
            sessions.broadcastToRoom(room, String.format("%s joins the fight against %s!\n", p.getName(), mob.getName()),
                List.of(p.getName()));
        } else {
            p.send(String.format("You attack %s!\n", mob.getName()));
            sessions.broadcastToRoom(room, String.format("%s attacks %s!\n", p.getName(), mob.getName()),
                List.of(p.getName()));
        }
        logger.debug("[CombatManager] {} engaged {} in {}", p.getName(), mob, room.getId());
        return true;
    }

    /**
     * Leave combat through the first usable exit.
     * @return true if the player got away
     */
    public boolean playerFlee(Player p) {
        if (!p.isInCombat()) {
            p.send("You aren't fighting anyone.\n");
            return false;
        }
        Room room = world.getRoom(p.getCurrentRoom());
        if (room == null) {
            p.endCombat();
            return false;
        }
        String dest = null;
        Direction dir = null;
        for (Map.Entry<Direction, String> e : room.getExits().entrySet()) {
            if (world.getRoom(e.getValue()) != null) {
                dest = e.getValue();
                dir = e.getKey();
                break;
            }
        }
        if (dest == null) {
            p.send("There is nowhere to run!\n");
            return false;
        }

        Mobile mob = room.findMobileFor(p.getName(), p.getCombatTarget());
        if (mob != null) {
            mob.disengage(p.getName());
        }
        p.endCombat();

        p.send(String.format("You flee %s!\n", dir.getDisplayName()));
        sessions.broadcastToRoom(room, String.format("%s flees %s!\n", p.getName(), dir.getDisplayName()),
            List.of(p.getName()));
        world.movePlayer(p, dest);
        Room to = world.getRoom(dest);
        p.send(to.describe(p.getName()));
        return true;
    }

    public AggressionScanner getAggressionScanner() {
        return aggressionScanner;
    }

    public DeathHandler getDeathHandler() {
        return deathHandler;
    }
}
