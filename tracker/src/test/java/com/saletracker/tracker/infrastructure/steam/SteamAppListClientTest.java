package com.saletracker.tracker.infrastructure.steam;

import static com.saletracker.tracker.test.fixtures.TrackerFixtures.API_KEY;
import static com.saletracker.tracker.test.fixtures.TrackerFixtures.CATALOG_BASE_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.saletracker.tracker.domain.catalog.CatalogEntry;
import com.saletracker.tracker.domain.exceptions.CatalogSyncException;
import com.saletracker.tracker.test.fixtures.TrackerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SteamAppListClientTest {

    private static final String APP_LIST_URL = CATALOG_BASE_URL + SteamAppListClient.APP_LIST_PATH;

    private MockRestServiceServer server;
    private SteamAppListClient client;

    @BeforeEach
    void setUp() {
        var builder = RestClient.builder().baseUrl(CATALOG_BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new SteamAppListClient(builder.build(), TrackerFixtures.properties());
    }

    @Test
    void shouldRequestPageFromCursorWithConfiguredFilters() {
        // given
        server.expect(requestTo(startsWith(APP_LIST_URL)))
                .andExpect(queryParam("key", API_KEY))
                .andExpect(queryParam("max_results", "100"))
                .andExpect(queryParam("last_appid", "620"))
                .andExpect(queryParam("include_games", "true"))
                .andExpect(queryParam("include_videos", "false"))
                .andExpect(queryParam("include_hardware", "false"))
                .andRespond(withSuccess("""
                        {"response": {
                            "apps": [
                                {"appid": 1091500, "name": "Cyberpunk 2077", "last_modified": 1700000000},
                                {"appid": 1145360, "name": "Hades"}
                            ],
                            "have_more_results": true,
                            "last_appid": 1145360
                        }}
                        """, MediaType.APPLICATION_JSON));

        // when
        var page = client.fetchPage(620);

        // then
        assertThat(page.entries()).containsExactly(
                new CatalogEntry("Cyberpunk 2077", 1091500), new CatalogEntry("Hades", 1145360));
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextCursor()).isEqualTo(1145360L);
        server.verify();
    }

    @Test
    void shouldTreatMissingFlagsAsLastPage() {
        // given
        server.expect(requestTo(startsWith(APP_LIST_URL)))
                .andRespond(withSuccess("""
                        {"response": {"apps": [{"appid": 620, "name": "Portal 2"}, {"name": "no id"}]}}
                        """, MediaType.APPLICATION_JSON));

        // when
        var page = client.fetchPage(0);

        // then
        assertThat(page.entries()).containsExactly(new CatalogEntry("Portal 2", 620));
        assertThat(page.hasMore()).isFalse();
        assertThat(page.nextCursor()).isNull();
    }

    @Test
    void shouldRejectBodyWithoutResponseObject() {
        // given
        server.expect(requestTo(startsWith(APP_LIST_URL)))
                .andRespond(withSuccess("{\"error\": \"nope\"}", MediaType.APPLICATION_JSON));

        // when / then
        assertThatThrownBy(() -> client.fetchPage(0))
                .isInstanceOf(CatalogSyncException.class)
                .hasMessageContaining("missing 'response' object");
    }

    @Test
    void shouldRejectUnparseableBody() {
        // given
        server.expect(requestTo(startsWith(APP_LIST_URL)))
                .andRespond(withSuccess("not json", MediaType.TEXT_PLAIN));

        // when / then
        assertThatThrownBy(() -> client.fetchPage(0)).isInstanceOf(CatalogSyncException.class);
    }

    @Test
    void shouldNeverExposeApiKeyInTransportErrors() {
        // given
        server.expect(requestTo(startsWith(APP_LIST_URL))).andRespond(withStatus(HttpStatus.FORBIDDEN));

        // when / then
        assertThatThrownBy(() -> client.fetchPage(0))
                .isInstanceOf(CatalogSyncException.class)
                .hasMessageNotContaining(API_KEY)
                .hasNoCause();
    }
}
