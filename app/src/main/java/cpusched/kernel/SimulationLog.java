package cpusched.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event log of a run. Entries are stamped with simulated time, so the log of
 * a run is identical every time it is repeated. Listeners see each entry as
 * it is added (the CLI prints them, the GUI appends them to its console).
 */
public class SimulationLog {

    public interface Listener {
        void eventLogged(String entry);
    }

    private final List<String> entries = new ArrayList<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public void log(int time, String message) {
        String entry = String.format("[t=%4d] %s", time, message);
        synchronized (entries) {
            entries.add(entry);
        }
        for (Listener listener : listeners) {
            listener.eventLogged(entry);
        }
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public List<String> getEntries() {
        synchronized (entries) {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
