package mu.fleet.config;

import mu.fleet.model.MachineIdentity;

import java.util.Iterator;
import java.util.List;

/**
 * The static list of machines the hive gathers from, in file order.
 */
public final class Roster implements Iterable<MachineIdentity> {

    private final List<MachineIdentity> machines;

    public Roster(List<MachineIdentity> machines) {
        this.machines = List.copyOf(machines);
    }

    public List<MachineIdentity> machines() {
        return machines;
    }

    public int size() {
        return machines.size();
    }

    public boolean isEmpty() {
        return machines.isEmpty();
    }

    @Override
    public Iterator<MachineIdentity> iterator() {
        return machines.iterator();
    }

    @Override
    public String toString() {
        return "Roster{machines=" + machines.size() + '}';
    }
}
