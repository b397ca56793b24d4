package org.cataphract.runtime.model;

import org.cataphract.runtime.api.NotFoundException;
import org.cataphract.runtime.audit.AuditLog;
import org.cataphract.runtime.map.MapGraph;
import org.cataphract.runtime.orders.Order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Root of all campaign state. Entities live in id-keyed arenas and refer to one
 * another by id only, which keeps a deep copy cheap and free of cycles.
 * <p>
 * Arenas are sorted maps so that every iteration over them, and therefore every
 * resolution, happens in the same order on every run.
 */
public class Campaign {

    private final long id;
    private final String name;
    private final long seed;
    private Tick currentTick;
    private Season season;
    private Weather weather;
    private CampaignStatus status;
    private MapGraph map;

    private Map<Long, Faction> factions = new TreeMap<>();
    private Map<Long, UnitType> unitTypes = new TreeMap<>();
    private Map<Long, Commander> commanders = new TreeMap<>();
    private Map<Long, Army> armies = new TreeMap<>();
    private Map<Long, Stronghold> strongholds = new TreeMap<>();
    private Map<Long, Siege> sieges = new TreeMap<>();
    private Map<Long, Ship> ships = new TreeMap<>();
    private Map<Long, Message> messages = new TreeMap<>();
    private Map<Long, Operation> operations = new TreeMap<>();
    private Map<Long, RecruitmentProject> projects = new TreeMap<>();
    private Map<Long, MercenaryContract> contracts = new TreeMap<>();
    private Map<Long, Order> orders = new TreeMap<>();

    private AuditLog auditLog = new AuditLog();
    private List<TickError> tickErrors = new ArrayList<>();
    private long nextId = 1;
    private long nextOrderSequence = 1;

    public Campaign(long id, String name, long seed, MapGraph map) {
        this.id = id;
        this.name = name;
        this.seed = seed;
        this.map = map;
        this.currentTick = Tick.of(0, DayPart.MORNING);
        this.season = Season.SPRING;
        this.weather = Weather.CLEAR;
        this.status = CampaignStatus.ACTIVE;
    }

    /**
     * @return an independent copy of the whole campaign, audit log included.
     */
    public Campaign deepCopy() {
        Campaign copy = new Campaign(id, name, seed, map.copy());
        copy.copyStateFrom(this);
        return copy;
    }

    /**
     * Replaces this campaign's state with a copy of the given snapshot, used to roll back a part.
     *
     * @param snapshot A copy taken earlier from this same campaign.
     */
    public void restoreFrom(Campaign snapshot) {
        if (snapshot.id != id) {
            throw new IllegalArgumentException("Snapshot of campaign " + snapshot.id + " cannot restore campaign " + id);
        }
        this.map = snapshot.map.copy();
        copyStateFrom(snapshot);
    }

    private void copyStateFrom(Campaign other) {
        this.currentTick = other.currentTick;
        this.season = other.season;
        this.weather = other.weather;
        this.status = other.status;
        this.factions = new TreeMap<>(other.factions);
        this.unitTypes = new TreeMap<>(other.unitTypes);
        this.commanders = copyArena(other.commanders, Commander::copy);
        this.armies = copyArena(other.armies, Army::copy);
        this.strongholds = copyArena(other.strongholds, Stronghold::copy);
        this.sieges = copyArena(other.sieges, Siege::copy);
        this.ships = copyArena(other.ships, Ship::copy);
        this.messages = copyArena(other.messages, Message::copy);
        this.operations = copyArena(other.operations, Operation::copy);
        this.projects = copyArena(other.projects, RecruitmentProject::copy);
        this.contracts = copyArena(other.contracts, MercenaryContract::copy);
        this.orders = copyArena(other.orders, Order::copy);
        this.auditLog = other.auditLog.copy();
        this.tickErrors = new ArrayList<>(other.tickErrors);
        this.nextId = other.nextId;
        this.nextOrderSequence = other.nextOrderSequence;
    }

    private static <T> Map<Long, T> copyArena(Map<Long, T> source, Function<T, T> copier) {
        Map<Long, T> result = new TreeMap<>();
        source.forEach((key, value) -> result.put(key, copier.apply(value)));
        return result;
    }

    /**
     * @return a fresh entity id, unique across all arenas.
     */
    public long allocateId() {
        return nextId++;
    }

    public long allocateOrderSequence() {
        return nextOrderSequence++;
    }

    private void reserve(long usedId) {
        nextId = Math.max(nextId, usedId + 1);
    }

    // Registration, used by hosts hydrating a campaign and by the rules when they create entities.

    public void addFaction(Faction faction) {
        reserve(faction.id());
        factions.put(faction.id(), faction);
    }

    public void addUnitType(UnitType unitType) {
        reserve(unitType.id());
        unitTypes.put(unitType.id(), unitType);
    }

    public void addCommander(Commander commander) {
        reserve(commander.getId());
        commanders.put(commander.getId(), commander);
    }

    public void addArmy(Army army) {
        reserve(army.getId());
        for (Detachment detachment : army.getDetachments()) {
            reserve(detachment.getId());
        }
        armies.put(army.getId(), army);
    }

    public void addStronghold(Stronghold stronghold) {
        reserve(stronghold.getId());
        strongholds.put(stronghold.getId(), stronghold);
    }

    public void addSiege(Siege siege) {
        reserve(siege.getId());
        sieges.put(siege.getId(), siege);
    }

    public void addShip(Ship ship) {
        reserve(ship.getId());
        ships.put(ship.getId(), ship);
    }

    public void addMessage(Message message) {
        reserve(message.getId());
        messages.put(message.getId(), message);
    }

    public void addOperation(Operation operation) {
        reserve(operation.getId());
        operations.put(operation.getId(), operation);
    }

    public void addProject(RecruitmentProject project) {
        reserve(project.getId());
        projects.put(project.getId(), project);
    }

    public void addContract(MercenaryContract contract) {
        reserve(contract.getId());
        contracts.put(contract.getId(), contract);
    }

    public void addOrder(Order order) {
        reserve(order.getId());
        orders.put(order.getId(), order);
    }

    // Lookups that fail with NotFoundException.

    public Commander requireCommander(long commanderId) throws NotFoundException {
        return require(commanders, commanderId, "Commander");
    }

    public Army requireArmy(long armyId) throws NotFoundException {
        return require(armies, armyId, "Army");
    }

    public Stronghold requireStronghold(long strongholdId) throws NotFoundException {
        return require(strongholds, strongholdId, "Stronghold");
    }

    public Ship requireShip(long shipId) throws NotFoundException {
        return require(ships, shipId, "Ship");
    }

    public Operation requireOperation(long operationId) throws NotFoundException {
        return require(operations, operationId, "Operation");
    }

    public RecruitmentProject requireProject(long projectId) throws NotFoundException {
        return require(projects, projectId, "Recruitment project");
    }

    public UnitType requireUnitType(long unitTypeId) throws NotFoundException {
        return require(unitTypes, unitTypeId, "Unit type");
    }

    public Order requireOrder(long orderId) throws NotFoundException {
        return require(orders, orderId, "Order");
    }

    public void requireHex(long hexId) throws NotFoundException {
        if (!map.hasHex(hexId)) {
            throw new NotFoundException("Hex " + hexId + " does not exist");
        }
    }

    private static <T> T require(Map<Long, T> arena, long entityId, String kind) throws NotFoundException {
        T entity = arena.get(entityId);
        if (entity == null) {
            throw new NotFoundException(kind + " " + entityId + " does not exist");
        }
        return entity;
    }

    /**
     * @return the army the commander currently leads, if any.
     */
    public Optional<Army> findArmyOf(long commanderId) {
        return armies.values().stream()
                .filter(army -> army.getCommanderId() != null && army.getCommanderId() == commanderId)
                .findFirst();
    }

    /**
     * @return the faction of the army's commander, if the army has a commander.
     */
    public Optional<Long> factionOf(Army army) {
        if (army.getCommanderId() == null) {
            return Optional.empty();
        }
        Commander commander = commanders.get(army.getCommanderId());
        return commander == null ? Optional.empty() : Optional.of(commander.getFactionId());
    }

    public Optional<Siege> findActiveSiege(long strongholdId) {
        return sieges.values().stream()
                .filter(siege -> siege.isActive() && siege.getStrongholdId() == strongholdId)
                .findFirst();
    }

    /**
     * Takes an order off the queue of its army, or of its commander for commander-level orders.
     */
    public void dequeue(Order order) {
        Long orderId = order.getId();
        if (order.getArmyId() != null) {
            Army army = armies.get(order.getArmyId());
            if (army != null) {
                army.getPendingOrderIds().remove(orderId);
            }
        }
        Commander commander = commanders.get(order.getCommanderId());
        if (commander != null) {
            commander.getPendingOrderIds().remove(orderId);
        }
    }

    public void recordTickError(TickError error) {
        tickErrors.add(error);
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getSeed() {
        return seed;
    }

    public Tick getCurrentTick() {
        return currentTick;
    }

    public void setCurrentTick(Tick currentTick) {
        this.currentTick = currentTick;
    }

    public int getCurrentDay() {
        return currentTick.day();
    }

    public DayPart getCurrentPart() {
        return currentTick.part();
    }

    public Season getSeason() {
        return season;
    }

    public void setSeason(Season season) {
        this.season = season;
    }

    public Weather getWeather() {
        return weather;
    }

    public void setWeather(Weather weather) {
        this.weather = weather;
    }

    public CampaignStatus getStatus() {
        return status;
    }

    public void setStatus(CampaignStatus status) {
        this.status = status;
    }

    public MapGraph getMap() {
        return map;
    }

    public Map<Long, Faction> getFactions() {
        return Collections.unmodifiableMap(factions);
    }

    public Map<Long, UnitType> getUnitTypes() {
        return Collections.unmodifiableMap(unitTypes);
    }

    public Map<Long, Commander> getCommanders() {
        return Collections.unmodifiableMap(commanders);
    }

    public Map<Long, Army> getArmies() {
        return Collections.unmodifiableMap(armies);
    }

    public Map<Long, Stronghold> getStrongholds() {
        return Collections.unmodifiableMap(strongholds);
    }

    public Map<Long, Siege> getSieges() {
        return Collections.unmodifiableMap(sieges);
    }

    public Map<Long, Ship> getShips() {
        return Collections.unmodifiableMap(ships);
    }

    public Map<Long, Message> getMessages() {
        return Collections.unmodifiableMap(messages);
    }

    public Map<Long, Operation> getOperations() {
        return Collections.unmodifiableMap(operations);
    }

    public Map<Long, RecruitmentProject> getProjects() {
        return Collections.unmodifiableMap(projects);
    }

    public Map<Long, MercenaryContract> getContracts() {
        return Collections.unmodifiableMap(contracts);
    }

    public Map<Long, Order> getOrders() {
        return Collections.unmodifiableMap(orders);
    }

    public AuditLog getAuditLog() {
        return auditLog;
    }

    public List<TickError> getTickErrors() {
        return Collections.unmodifiableList(tickErrors);
    }
}
