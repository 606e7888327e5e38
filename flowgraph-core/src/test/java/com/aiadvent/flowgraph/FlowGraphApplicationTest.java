package com.aiadvent.flowgraph;

import static org.assertj.core.api.Assertions.assertThat;

import com.aiadvent.flowgraph.analysis.FlowGraphService;
import com.aiadvent.flowgraph.config.FlowGraphProperties;
import com.aiadvent.flowgraph.extract.DetailLevel;
import com.aiadvent.flowgraph.graph.ExtractionResult;
import com.aiadvent.flowgraph.graph.FlowNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "flowgraph.labels.condition-max-length=3")
class FlowGraphApplicationTest {

  @Autowired private FlowGraphService service;

  @Autowired private FlowGraphProperties properties;

  @Test
  void bindsPropertiesFromConfiguration() {
    assertThat(properties.getLanguages()).containsExactly("python", "javascript", "typescript");
    assertThat(properties.getExtensions()).containsEntry("mjs", "javascript");
    assertThat(properties.getExtraction().getDetailLevel()).isEqualTo(DetailLevel.FULL);
    assertThat(properties.getLabels().getConditionMaxLength()).isEqualTo(3);
  }

  @Test
  void analyzesThroughTheWiredPipeline() {
    ExtractionResult result = service.analyze("if ready:\n    go()\n", "boot.py", "python");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.nodes()).extracting(FlowNode::label).contains("L1: if (rea)", "L2: go()");
    assertThat(result.nodes()).extracting(FlowNode::id).contains("file_boot.py_logic_group");
  }
}
