package com.teenagi.agent.function;

import com.teenagi.agent.exception.DuplicateRegistrationException;
import com.teenagi.agent.exception.FunctionNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Functions an agent may call, indexed by name for dispatch.
 *
 * Shared by every concurrent {@code respond} call of one agent. Lookups take the
 * read lock; registration takes the write lock. Registration order is kept so
 * the model always sees the functions in the order they were declared.
 */
@Slf4j
public class FunctionRegistry {

    private final Map<String, RegisteredFunction> functions = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final RegistrationPolicy policy;

    public FunctionRegistry() {
        this(RegistrationPolicy.REPLACE);
    }

    public FunctionRegistry(RegistrationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public RegisteredFunction register(FunctionDescriptor descriptor, FunctionInvoker invoker) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(invoker, "invoker");

        RegisteredFunction registered = new RegisteredFunction(descriptor, invoker);
        lock.writeLock().lock();
        try {
            RegisteredFunction previous = functions.get(descriptor.getName());
            if (previous != null && policy == RegistrationPolicy.REJECT) {
                throw new DuplicateRegistrationException(descriptor.getName());
            }
            functions.put(descriptor.getName(), registered);
            if (previous != null) {
                log.info("Replaced function: [{}]", descriptor.getName());
            } else {
                log.info("Registered function: [{}] - {}", descriptor.getName(), descriptor.getDescription());
            }
        } finally {
            lock.writeLock().unlock();
        }
        return registered;
    }

    public RegisteredFunction register(AgentFunction function) {
        return register(function.getDescriptor(), function);
    }

    public RegisteredFunction resolve(String name) {
        lock.readLock().lock();
        try {
            RegisteredFunction function = name == null ? null : functions.get(name);
            if (function == null) {
                throw new FunctionNotFoundException(name);
            }
            return function;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasFunction(String name) {
        lock.readLock().lock();
        try {
            return functions.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<FunctionDescriptor> descriptors() {
        lock.readLock().lock();
        try {
            return functions.values().stream()
                    .map(RegisteredFunction::descriptor)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** One human-readable line per function, for the system prompt. */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        for (FunctionDescriptor descriptor : descriptors()) {
            lines.add(descriptor.signature());
        }
        return lines;
    }

    public Set<String> names() {
        lock.readLock().lock();
        try {
            return new LinkedHashSet<>(functions.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return functions.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
