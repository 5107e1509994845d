package tw.gc.strategy.optimizer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import tw.gc.strategy.optimizer.enums.RankingMetric;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.services.storage.ResultsStore;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.strategy.optimizer.OptimizerFixtures.START;
import static tw.gc.strategy.optimizer.OptimizerFixtures.pqRequest;

class OptimizationRequestTest {

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("should accept a complete grid request")
        void shouldAcceptCompleteRequest() {
            assertThatCode(() -> pqRequest(SearchKind.GRID).build().validate()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject an inverted date range")
        void shouldRejectInvertedDates() {
            OptimizationRequest request = pqRequest(SearchKind.GRID).endDate(START.minusDays(1)).build();

            assertThatThrownBy(request::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("startDate");
        }

        @Test
        @DisplayName("should reject non-positive capital")
        void shouldRejectNonPositiveCapital() {
            assertThatThrownBy(() -> pqRequest(SearchKind.GRID).capital(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capital");
        }

        @Test
        @DisplayName("should reject a request without parameters")
        void shouldRejectMissingParameters() {
            assertThatThrownBy(() -> pqRequest(SearchKind.GRID).clearParameters().build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parameter");
        }

        @Test
        @DisplayName("should reject duplicate symbols")
        void shouldRejectDuplicateSymbols() {
            assertThatThrownBy(() -> pqRequest(SearchKind.GRID).symbol("2330.TW").build().validate())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should require adaptive settings for an adaptive run")
        void shouldRequireAdaptiveSettings() {
            assertThatThrownBy(() -> pqRequest(SearchKind.ADAPTIVE).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("adaptive");
        }

        @Test
        @DisplayName("should reject a zero concurrency")
        void shouldRejectZeroConcurrency() {
            assertThatThrownBy(() -> pqRequest(SearchKind.GRID).concurrency(0).build().validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
        }
    }

    @Nested
    @DisplayName("JSON")
    class JsonTests {

        private final ObjectMapper mapper = ResultsStore.createObjectMapper();

        @Test
        @DisplayName("should read a configuration document with both parameter kinds")
        void shouldReadConfiguration() throws Exception {
            String json = """
                {
                  "strategyId": "bollinger",
                  "symbols": ["2330.TW", "2317.TW"],
                  "startDate": "2023-01-01",
                  "endDate": "2023-12-31",
                  "parameters": [
                    {"kind": "discrete", "name": "period", "values": [10, 20, 30]},
                    {"kind": "range", "name": "width", "low": 1.5, "high": 2.5, "step": 0.5, "integral": false}
                  ],
                  "searchKind": "walk_forward",
                  "rankingMetric": "CALMAR",
                  "walkForward": {"inSampleDays": 90, "outSampleDays": 30, "stepDays": 30, "anchored": false}
                }
                """;

            OptimizationRequest request = mapper.readValue(json, OptimizationRequest.class);

            assertThat(request.getSearchKind()).isEqualTo(SearchKind.WALK_FORWARD);
            assertThat(request.getCapital()).isEqualTo(OptimizationRequest.DEFAULT_CAPITAL);
            assertThat(request.getRankingMetric()).isEqualTo(RankingMetric.CALMAR);
            assertThat(request.getParameters()).hasSize(2);
            assertThat(request.getParameters().get(0)).isEqualTo(DiscreteParameter.of("period", 10, 20, 30));
            assertThat(request.getParameters().get(1).values()).containsExactly(1.5, 2.0, 2.5);
            assertThatCode(request::validate).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should write search kinds and parameter kinds by code")
        void shouldWriteCodes() throws Exception {
            String json = mapper.writeValueAsString(pqRequest(SearchKind.WALK_FORWARD).build());

            assertThat(json).contains("\"searchKind\":\"walk_forward\"").contains("\"kind\":\"discrete\"");
        }
    }
}
