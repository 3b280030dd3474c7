package com.vibecoding.ocloud.orchestrator;

import com.vibecoding.ocloud.model.orchestration.AgentStatus;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 전문 에이전트 레지스트리
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ObjectProvider<PhaseAgent> agentBeans;
    private final Map<String, PhaseAgent> agents = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public AgentRegistry(ObjectProvider<PhaseAgent> agentBeans) {
        this.agentBeans = agentBeans;
    }

    /**
     * 컨텍스트에 등록된 에이전트 빈 등록
     */
    @PostConstruct
    public void registerBeans() {
        agentBeans.orderedStream().forEach(this::register);
        log.info("Agent registry initialized with {} agent(s)", size());
    }

    public void register(PhaseAgent agent) {
        lock.writeLock().lock();
        try {
            agents.put(agent.getName(), agent);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Agent registered: {} (capabilities: {})", agent.getName(), agent.getCapabilities());
    }

    public void unregister(String name) {
        lock.writeLock().lock();
        try {
            agents.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Agent unregistered: {}", name);
    }

    public Optional<PhaseAgent> find(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 등록된 에이전트 상태 (조회 실패 시 unhealthy)
     */
    public List<AgentStatus> statuses() {
        List<PhaseAgent> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(agents.values());
        } finally {
            lock.readLock().unlock();
        }

        List<AgentStatus> result = new ArrayList<>();
        for (PhaseAgent agent : snapshot) {
            try {
                result.add(agent.getStatus());
            } catch (RuntimeException e) {
                log.warn("Failed to get status of agent {}: {}", agent.getName(), e.getMessage());
                result.add(AgentStatus.builder().name(agent.getName()).healthy(false).build());
            }
        }
        return result;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
