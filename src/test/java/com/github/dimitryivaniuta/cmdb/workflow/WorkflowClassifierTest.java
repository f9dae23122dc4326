package com.github.dimitryivaniuta.cmdb.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowClassifierTest {

    @Test
    void transitBeatsGenericGateway() {
        assertThat(WorkflowClassifier.inferType("AWS Transit Gateway attachments")).isEqualTo(WorkflowType.TRANSIT_GATEWAY);
        assertThat(WorkflowClassifier.inferType("tgw-route-sync")).isEqualTo(WorkflowType.TRANSIT_GATEWAY);
        assertThat(WorkflowClassifier.inferType("Customer gateway inventory")).isEqualTo(WorkflowType.NAT_GATEWAY);
    }

    @Test
    void fallsBackToVpc() {
        assertThat(WorkflowClassifier.inferType("Site-to-site VPN tunnels")).isEqualTo(WorkflowType.VPN);
        assertThat(WorkflowClassifier.inferType("Subnet audit")).isEqualTo(WorkflowType.SUBNET);
        assertThat(WorkflowClassifier.inferType("nightly inventory")).isEqualTo(WorkflowType.VPC);
        assertThat(WorkflowClassifier.inferType(null)).isEqualTo(WorkflowType.VPC);
    }

    @Test
    void infersProviderFromNameOrNodes() {
        assertThat(WorkflowClassifier.inferProvider("Amazon VPC import")).isEqualTo(WorkflowProvider.AWS);
        assertThat(WorkflowClassifier.inferProvider("Microsoft vnet")).isEqualTo(WorkflowProvider.AZURE);
        assertThat(WorkflowClassifier.inferProvider("google network")).isEqualTo(WorkflowProvider.GCP);
        assertThat(WorkflowClassifier.inferProvider("aliyun vpc")).isEqualTo(WorkflowProvider.ALI);
        assertThat(WorkflowClassifier.inferProvider("Oracle cloud")).isEqualTo(WorkflowProvider.OCI);
        assertThat(WorkflowClassifier.inferProvider("Huawei VPC")).isEqualTo(WorkflowProvider.HUAWEI);
        assertThat(WorkflowClassifier.inferProvider("on-prem sync")).isEqualTo(WorkflowProvider.OTHERS);
    }

    @Test
    void searchTextIncludesNodeTypes() throws Exception {
        JsonNode workflow = new ObjectMapper().readTree("""
                {"name":"Inventory","nodes":[{"type":"n8n-nodes-base.awsLambda"},{"type":"n8n-nodes-base.set"}]}
                """);

        String text = WorkflowClassifier.searchText(workflow);

        assertThat(text).isEqualTo("Inventory n8n-nodes-base.awsLambda n8n-nodes-base.set");
        assertThat(WorkflowClassifier.inferProvider(text)).isEqualTo(WorkflowProvider.AWS);
    }
}
