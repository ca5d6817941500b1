package io.dagexec.core.isolation;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Throwables;
import io.dagexec.client.ObjectMappers;
import io.dagexec.client.config.Config;
import io.dagexec.core.task.CallableTask;
import io.dagexec.spi.TaskCallable;
import io.dagexec.spi.TaskReport;

import static java.util.Locale.ENGLISH;

/**
 * Entry point of the child JVM started by {@link ProcessIsolatedWorkerFactory}.
 *
 * Usage: {@code IsolatedTaskRunner <input.json> <output.json>}. Exits with 0
 * when the task succeeded and 1 when it failed; in both cases output.json is
 * written.
 *
 * The callable is recreated from its class name and the JSON properties the
 * parent wrote, so a callable sent here must keep all of its state in
 * properties Jackson can write and read back.
 */
public class IsolatedTaskRunner
{
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_TASK_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_OUTPUT_FAILED = 3;

    public static void main(String[] args)
    {
        if (args.length != 2) {
            System.err.println("usage: " + IsolatedTaskRunner.class.getName() + " <input.json> <output.json>");
            System.exit(EXIT_USAGE);
        }
        int code = new IsolatedTaskRunner(ObjectMappers.objectMapper())
            .run(Paths.get(args[0]), Paths.get(args[1]));
        System.exit(code);
    }

    private final ObjectMapper mapper;

    IsolatedTaskRunner(ObjectMapper mapper)
    {
        this.mapper = mapper;
    }

    int run(Path inputPath, Path outputPath)
    {
        ObjectNode output = mapper.createObjectNode();
        int code;
        try {
            JsonNode input = mapper.readTree(inputPath.toFile());
            String taskName = input.get("task").asText();
            TaskCallable callable = newCallable(mapper, input.get("callable").asText(), input.get("state"));
            Config params = mapper.treeToValue(input.get("params"), Config.class);

            TaskReport report = new CallableTask(taskName, callable).build(params);
            output.set("report", mapper.valueToTree(report));
            code = EXIT_SUCCESS;
        }
        catch (Throwable ex) {
            ObjectNode error = output.putObject("error");
            error.put("class", ex.getClass().getName());
            error.put("message", ex.getMessage());
            error.put("trace", Throwables.getStackTraceAsString(ex));
            code = EXIT_TASK_FAILED;
        }

        try {
            mapper.writeValue(outputPath.toFile(), output);
        }
        catch (IOException ex) {
            ex.printStackTrace(System.err);
            return EXIT_OUTPUT_FAILED;
        }
        return code;
    }

    static TaskCallable newCallable(ObjectMapper mapper, String className, JsonNode state)
        throws ReflectiveOperationException, IOException
    {
        Class<?> callableClass = Class.forName(className);
        checkInstantiable(callableClass);
        return (TaskCallable) mapper.treeToValue(state, callableClass);
    }

    /**
     * @throws IllegalArgumentException if an instance field of the class is not a property Jackson can write and read
     */
    static void checkStateCarried(ObjectMapper mapper, Class<?> callableClass)
    {
        JavaType type = mapper.constructType(callableClass);
        Set<String> written = new HashSet<>();
        for (BeanPropertyDefinition prop : mapper.getSerializationConfig().introspect(type).findProperties()) {
            if (prop.couldSerialize()) {
                written.add(prop.getInternalName());
            }
        }
        Set<String> read = new HashSet<>();
        for (BeanPropertyDefinition prop : mapper.getDeserializationConfig().introspect(type).findProperties()) {
            if (prop.couldDeserialize()) {
                read.add(prop.getInternalName());
            }
        }

        for (Class<?> c = callableClass; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                if (!written.contains(field.getName()) || !read.contains(field.getName())) {
                    throw new IllegalArgumentException(String.format(ENGLISH,
                                "field '%s' of %s can't be copied as a JSON property; " +
                                "make it public, add a getter and a setter, or declare it transient",
                                field.getName(), callableClass.getName()));
                }
            }
        }
    }

    /**
     * @throws IllegalArgumentException if the class can't be created by name in another JVM
     */
    static void checkInstantiable(Class<?> callableClass)
    {
        String name = callableClass.getName();
        if (!TaskCallable.class.isAssignableFrom(callableClass)) {
            throw new IllegalArgumentException(name + " is not a " + TaskCallable.class.getSimpleName());
        }
        if (callableClass.isSynthetic() || name.contains("$$Lambda")) {
            throw new IllegalArgumentException("lambda " + name + " can't be instantiated by name");
        }
        if (callableClass.isAnonymousClass() || callableClass.isLocalClass()) {
            throw new IllegalArgumentException(name + " is an anonymous or local class");
        }
        if (callableClass.isMemberClass() && !Modifier.isStatic(callableClass.getModifiers())) {
            throw new IllegalArgumentException(name + " is an inner class; declare it static");
        }
        if (!Modifier.isPublic(callableClass.getModifiers())) {
            throw new IllegalArgumentException(name + " is not public");
        }
        try {
            Constructor<?> constructor = callableClass.getConstructor();
            if (!Modifier.isPublic(constructor.getModifiers())) {
                throw new IllegalArgumentException(name + " has no public no-argument constructor");
            }
        }
        catch (NoSuchMethodException ex) {
            throw new IllegalArgumentException(name + " has no public no-argument constructor", ex);
        }
    }
}
