package com.trelloreport.weekly.service;

import com.trelloreport.weekly.config.WeeklyReportProperties;
import com.trelloreport.weekly.exception.ListNotFoundException;
import com.trelloreport.weekly.exception.TrelloTransportException;
import com.trelloreport.weekly.model.TrelloAction;
import com.trelloreport.weekly.model.TrelloCard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class TrelloApiClientTest {

    private static final String BASE = "https://api.trello.com/1";
    private static final String AUTH = "key=test-key&token=test-token";

    private MockRestServiceServer server;
    private RequestRateLimiter rateLimiter;
    private TrelloApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        rateLimiter = mock(RequestRateLimiter.class);

        var properties = new WeeklyReportProperties();
        properties.getApi().setKey("test-key");
        properties.getApi().setToken("test-token");

        client = new TrelloApiClient(restTemplate, rateLimiter, properties);
    }

    @Test
    void resolvesListIdByExactName() throws Exception {
        server.expect(requestTo(BASE + "/boards/board1/lists?" + AUTH))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [{"id":"l1","name":"To Do","closed":false},
                         {"id":"l2","name":"Done "},
                         {"id":"l3","name":"Done"},
                         {"id":"l4","name":"Done"}]
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.listIdByName("board1", "Done")).isEqualTo("l3");

        server.verify();
        verify(rateLimiter, times(1)).acquire();
    }

    @Test
    void missingListIsNotFound() {
        server.expect(requestTo(BASE + "/boards/board1/lists?" + AUTH))
                .andRespond(withSuccess("[{\"id\":\"l1\",\"name\":\"To Do\"}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.listIdByName("board1", "Doing"))
                .isInstanceOf(ListNotFoundException.class)
                .hasMessageContaining("Doing");
    }

    @Test
    void readsCardsWithLabels() {
        server.expect(requestTo(BASE + "/lists/l3/cards?" + AUTH))
                .andRespond(withSuccess("""
                        [{"id":"c1","name":"Ship it","url":"https://trello.com/c/abc/1-ship-it",
                          "idList":"l3","labels":[{"id":"x","name":"backend","color":"green"}]},
                         {"id":"c2","name":"No labels","url":"https://trello.com/c/def","labels":[]}]
                        """, MediaType.APPLICATION_JSON));

        List<TrelloCard> cards = client.cardsInList("l3");

        assertThat(cards).extracting(TrelloCard::getId).containsExactly("c1", "c2");
        assertThat(cards.get(0).getLabels()).extracting(TrelloCard.Label::getName).containsExactly("backend");
        assertThat(cards.get(1).getLabels()).isEmpty();
    }

    @Test
    void requestsActionsFilteredByType() {
        server.expect(requestTo(BASE + "/cards/c1/actions?" + AUTH + "&filter=updateCard"))
                .andRespond(withSuccess("""
                        [{"id":"a1","type":"updateCard","date":"2024-03-05T14:22:01.123Z",
                          "memberCreator":{"id":"m1","fullName":"Ada Lovelace"},
                          "data":{"listBefore":{"id":"l2","name":"Doing"},
                                  "listAfter":{"id":"l3","name":"Done"},
                                  "card":{"id":"c1"}}}]
                        """, MediaType.APPLICATION_JSON));

        List<TrelloAction> actions = client.actionsForCard("c1", TrelloAction.TYPE_UPDATE_CARD);

        assertThat(actions).hasSize(1);
        TrelloAction action = actions.get(0);
        assertThat(action.getMemberCreator().getFullName()).isEqualTo("Ada Lovelace");
        assertThat(action.getData().getListAfter().getName()).isEqualTo("Done");
        assertThat(action.getDate()).isEqualTo("2024-03-05T14:22:01.123Z");
    }

    @Test
    void serverErrorBecomesTransportError() {
        server.expect(requestTo(BASE + "/lists/l3/cards?" + AUTH)).andRespond(withServerError());

        assertThatThrownBy(() -> client.cardsInList("l3"))
                .isInstanceOf(TrelloTransportException.class)
                .hasCauseInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void tooManyRequestsBecomesTransportError() {
        server.expect(requestTo(BASE + "/cards/c9/actions?" + AUTH + "&filter=commentCard"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.actionsForCard("c9", TrelloAction.TYPE_COMMENT_CARD))
                .isInstanceOf(TrelloTransportException.class)
                .hasMessageContaining("rate limit");
    }
}
