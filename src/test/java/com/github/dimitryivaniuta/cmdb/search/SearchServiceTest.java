package com.github.dimitryivaniuta.cmdb.search;

import com.github.dimitryivaniuta.cmdb.error.ValidationFailedException;
import com.github.dimitryivaniuta.cmdb.resource.NetworkResourceEntity;
import com.github.dimitryivaniuta.cmdb.resource.PageResult;
import com.github.dimitryivaniuta.cmdb.resource.ResourceQuery;
import com.github.dimitryivaniuta.cmdb.resource.ResourceServiceRegistry;
import com.github.dimitryivaniuta.cmdb.resource.ResourceType;
import com.github.dimitryivaniuta.cmdb.resource.vpc.Vpc;
import com.github.dimitryivaniuta.cmdb.resource.vpc.VpcService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchServiceTest {

    @Test
    void emptyTypesMeansAllTypes() {
        assertThat(SearchService.parseTypes(null)).containsExactlyInAnyOrder(ResourceType.values());
        assertThat(SearchService.parseTypes(" , ")).containsExactlyInAnyOrder(ResourceType.values());
    }

    @Test
    void typesAcceptPathsAndNames() {
        assertThat(SearchService.parseTypes("vpcs, transit_gateway,vpc-endpoints"))
                .containsExactlyInAnyOrder(ResourceType.VPC, ResourceType.TRANSIT_GATEWAY, ResourceType.VPC_ENDPOINT);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> SearchService.parseTypes("vpcs,subnets"))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                        ex -> assertThat(ex.getErrors().get(0).field()).isEqualTo("types"));
    }

    @Test
    void shortTermIsRejected() {
        SearchService search = new SearchService(mock(ResourceServiceRegistry.class));

        assertThatThrownBy(() -> search.search(" a ", null, null, null))
                .isInstanceOfSatisfying(ValidationFailedException.class,
                        ex -> assertThat(ex.getErrors().get(0).field()).isEqualTo("q"));
    }

    @Test
    void searchesSelectedTypeWithTermAndRegion() {
        ResourceServiceRegistry registry = mock(ResourceServiceRegistry.class);
        VpcService vpcs = mock(VpcService.class);
        doReturn(vpcs).when(registry).get(ResourceType.VPC);
        Vpc hit = new Vpc();
        hit.setExternalId("vpc-0a1b2c3d");
        ArgumentCaptor<ResourceQuery> query = ArgumentCaptor.forClass(ResourceQuery.class);
        when(vpcs.findAll(query.capture())).thenReturn(PageResult.of(List.of(hit), 1, 1, 5));

        List<SearchHit> hits = new SearchService(registry).search(" prod ", "vpcs", "us-east-1", 5);

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).resourceType()).isEqualTo("vpcs");
        assertThat(hits.get(0).totalCount()).isEqualTo(1);
        assertThat(hits.get(0).items()).extracting(NetworkResourceEntity::getExternalId).containsExactly("vpc-0a1b2c3d");
        verify(vpcs).findAll(query.getValue());
        assertThat(query.getValue().search()).isEqualTo("prod");
        assertThat(query.getValue().region()).isEqualTo("us-east-1");
        assertThat(query.getValue().limit()).isEqualTo(5);
    }
}
