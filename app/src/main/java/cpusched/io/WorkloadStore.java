package cpusched.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import cpusched.Exception.DuplicateIdException;
import cpusched.Exception.InvalidInputException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and loads workloads as a JSON array of
 * {@code {"pid", "arrival", "burst", "priority", "dependencies"}} objects.
 */
public class WorkloadStore {
    private static final TypeReference<List<TaskRecord>> RECORDS = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public WorkloadStore() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public TaskRegistry load(Path file) throws IOException, InvalidInputException, DuplicateIdException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public TaskRegistry read(InputStream in) throws IOException, InvalidInputException, DuplicateIdException {
        List<TaskRecord> records;
        try {
            records = mapper.readValue(in, RECORDS);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed workload file: " + e.getOriginalMessage(), e);
        }
        TaskRegistry registry = new TaskRegistry();
        if (records == null) {
            return registry;
        }
        for (TaskRecord record : records) {
            registry.add(record.toTask());
        }
        return registry;
    }

    public void save(TaskRegistry registry, Path file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file)) {
            write(registry, out);
        }
    }

    public void write(TaskRegistry registry, OutputStream out) throws IOException {
        List<TaskRecord> records = new ArrayList<>();
        for (Task task : registry.getTasks()) {
            records.add(TaskRecord.from(task));
        }
        mapper.writeValue(out, records);
    }
}
