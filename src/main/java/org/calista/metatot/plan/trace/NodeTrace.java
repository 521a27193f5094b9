package org.calista.metatot.plan.trace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.metatot.plan.inference.ActiveInferenceState;
import org.calista.metatot.plan.tree.DomainPhase;
import org.calista.metatot.plan.tree.ThoughtNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class NodeTrace {
    @JsonProperty("id")
    public String id;
    @JsonProperty("session_id")
    public String sessionId;
    @JsonProperty("parent_id")
    public String parentId;     // null for root
    @JsonProperty("depth")
    public int depth;
    @JsonProperty("phase")
    public DomainPhase phase;
    @JsonProperty("content")
    public String content;
    @JsonProperty("score")
    public double score;
    @JsonProperty("visit_count")
    public int visitCount;
    @JsonProperty("value_estimate")
    public double valueEstimate;
    @JsonProperty("efe")
    public double efe;
    @JsonProperty("is_selected")
    public boolean selected;
    @JsonProperty("failed")
    public boolean failed;
    @JsonProperty("state")
    public ActiveInferenceState state;

    public static NodeTrace of(ThoughtNode n) {
        NodeTrace t = new NodeTrace();
        t.id = n.id();
        t.sessionId = n.sessionId();
        t.parentId = n.parentId();
        t.depth = n.depth();
        t.phase = n.phase();
        t.content = n.content();
        t.score = n.score();
        t.visitCount = n.visits();
        t.valueEstimate = n.valueEstimate();
        t.efe = n.efe();
        t.selected = n.isSelected();
        t.failed = n.isFailed();
        t.state = n.state();
        return t;
    }
}
