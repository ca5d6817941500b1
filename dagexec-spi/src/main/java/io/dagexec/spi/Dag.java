package io.dagexec.spi;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Tasks in dependency order plus the resource clients they share.
 *
 * <p>
 * Skip and abort decisions are already applied to the status of each task
 * when a Dag is handed to an executor.
 * </p>
 */
@Value.Immutable
public interface Dag
{
    String getName();

    List<Task> getTasks();

    Map<String, ResourceClient> getClients();

    @Value.Check
    default void checkUniqueTaskNames()
    {
        Set<String> names = new HashSet<>();
        for (Task task : getTasks()) {
            if (!names.add(task.getName())) {
                throw new IllegalArgumentException("Duplicated task name in DAG '" + getName() + "': " + task.getName());
            }
        }
    }

    static ImmutableDag.Builder builder()
    {
        return ImmutableDag.builder();
    }
}
