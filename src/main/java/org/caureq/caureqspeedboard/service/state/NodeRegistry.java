package org.caureq.caureqspeedboard.service.state;

import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.domain.NodeMeta;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Configured node metadata and display order. Independent of whether a node ever reported.
 */
@Slf4j
@Component
public class NodeRegistry {
    private final Map<String, NodeMeta> configured;
    private final Set<String> warnedUnknown = ConcurrentHashMap.newKeySet();

    public NodeRegistry(AppProps props) {
        var m = new LinkedHashMap<String, NodeMeta>();
        int rank = 0;
        for (var n : props.nodes()) {
            var id = n.id().trim();
            if (m.containsKey(id)) {
                log.warn("[Nodes] duplicate node id '{}' in configuration, keeping the first entry", id);
                continue;
            }
            m.put(id, new NodeMeta(id, n.flag(), n.displayName(), rank++));
        }
        this.configured = Collections.unmodifiableMap(m);
        log.info("[Nodes] {} configured: {}", configured.size(), configured.keySet());
    }

    public boolean isConfigured(String nodeId) {
        return configured.containsKey(nodeId);
    }

    public Collection<NodeMeta> configured() {
        return configured.values();
    }

    public NodeMeta meta(String nodeId) {
        var meta = configured.get(nodeId);
        return meta != null ? meta : NodeMeta.unconfigured(nodeId);
    }

    /** Logs a config suggestion the first time an unconfigured node reports. */
    public void noteReporting(String nodeId) {
        if (isConfigured(nodeId) || !warnedUnknown.add(nodeId)) return;
        log.warn("[Nodes] unknown node_id \"{}\", add it to app.nodes. suggested config:\n"
                + "    - id: {}\n"
                + "      flag: \"🏳️\"\n"
                + "      display-name: \"Node {}\"", nodeId, nodeId, nodeId);
    }

    /**
     * Configured nodes by rank, then any extra reporting nodes alphabetically.
     */
    public List<NodeMeta> ordered(Collection<String> reportingNodeIds) {
        var out = new ArrayList<>(configured.values());
        var extra = new TreeSet<String>();
        for (var id : reportingNodeIds) {
            if (!configured.containsKey(id)) extra.add(id);
        }
        for (var id : extra) out.add(NodeMeta.unconfigured(id));
        return out;
    }
}
