package com.triagebot.core.graph;

import com.triagebot.core.memory.IssueMemoryStore;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.nodes.AssessPriorityNode;
import com.triagebot.core.nodes.CheckDuplicatesNode;
import com.triagebot.core.nodes.ClassifyIssueNode;
import com.triagebot.core.nodes.CompleteTriageNode;
import com.triagebot.core.nodes.FetchIssueNode;
import com.triagebot.core.nodes.StoreIssueNode;
import com.triagebot.core.state.TriageState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs one issue
 * through the triage stages.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> fetch_issue -> classify_issue -> [routeAfterClassify]
 *         -> check_duplicates -> assess_priority      (memory store configured)
 *         -> assess_priority                         (no memory store)
 *   assess_priority -> [routeAfterAssess]
 *         -> store_issue -> complete -> END          (memory store configured)
 *         -> complete -> END                         (no memory store)
 * </pre>
 * Every stage routes straight to END once the state is FAILED.
 */
@Component
public class TriageGraph {

    private static final Logger log = LoggerFactory.getLogger(TriageGraph.class);

    static final String FETCH = "fetch_issue";
    static final String CLASSIFY = "classify_issue";
    static final String CHECK_DUPLICATES = "check_duplicates";
    static final String ASSESS = "assess_priority";
    static final String STORE = "store_issue";
    static final String COMPLETE = "complete";
    static final String FAIL = "end";

    private final boolean memoryEnabled;
    private final CompiledGraph<TriageState> compiledGraph;

    public TriageGraph(
            FetchIssueNode fetchNode,
            ClassifyIssueNode classifyNode,
            CheckDuplicatesNode checkDuplicatesNode,
            AssessPriorityNode assessNode,
            StoreIssueNode storeNode,
            CompleteTriageNode completeNode,
            @Autowired(required = false) IssueMemoryStore store) throws Exception {

        this.memoryEnabled = store != null;

        var graph = new StateGraph<>(TriageState.SCHEMA, TriageState::new)
                .addNode(FETCH, node_async(fetchNode::apply))
                .addNode(CLASSIFY, node_async(classifyNode::apply))
                .addNode(CHECK_DUPLICATES, node_async(checkDuplicatesNode::apply))
                .addNode(ASSESS, node_async(assessNode::apply))
                .addNode(STORE, node_async(storeNode::apply))
                .addNode(COMPLETE, node_async(completeNode::apply))
                .addEdge(START, FETCH)
                .addConditionalEdges(FETCH,
                        edge_async(state -> continueOrEnd(state, CLASSIFY)),
                        Map.of(CLASSIFY, CLASSIFY, FAIL, END))
                .addConditionalEdges(CLASSIFY,
                        edge_async(this::routeAfterClassify),
                        Map.of(CHECK_DUPLICATES, CHECK_DUPLICATES, ASSESS, ASSESS, FAIL, END))
                .addConditionalEdges(CHECK_DUPLICATES,
                        edge_async(state -> continueOrEnd(state, ASSESS)),
                        Map.of(ASSESS, ASSESS, FAIL, END))
                .addConditionalEdges(ASSESS,
                        edge_async(this::routeAfterAssess),
                        Map.of(STORE, STORE, COMPLETE, COMPLETE, FAIL, END))
                .addConditionalEdges(STORE,
                        edge_async(state -> continueOrEnd(state, COMPLETE)),
                        Map.of(COMPLETE, COMPLETE, FAIL, END))
                .addEdge(COMPLETE, END);

        this.compiledGraph = graph.compile();
        log.info("Triage graph compiled {} memory stages", memoryEnabled ? "with" : "without");
    }

    /**
     * Routes after classify_issue. The duplicate check needs a memory store.
     */
    String routeAfterClassify(TriageState state) {
        return continueOrEnd(state, memoryEnabled ? CHECK_DUPLICATES : ASSESS);
    }

    /**
     * Routes after assess_priority. Storing needs a memory store.
     */
    String routeAfterAssess(TriageState state) {
        return continueOrEnd(state, memoryEnabled ? STORE : COMPLETE);
    }

    static String continueOrEnd(TriageState state, String next) {
        return state.status() == TriageStage.FAILED ? FAIL : next;
    }

    public boolean isMemoryEnabled() {
        return memoryEnabled;
    }

    public CompiledGraph<TriageState> getCompiledGraph() {
        return compiledGraph;
    }
}
