package com.fluforecast.controller;

import com.fluforecast.model.Decimals;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SampleDataControllerIntegrationTest {

    @Autowired TestRestTemplate restTemplate;

    @Test
    void data_returnsMostRecentRows() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sample/data?limit=5", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("count")).isEqualTo(312);
        List<Map<String, Object>> data = (List<Map<String, Object>>) resp.getBody().get("data");
        assertThat(data).hasSize(5);
        assertThat(data.get(4)).containsEntry("year", 2025).containsEntry("week", 52);
    }

    @Test
    void data_limitOutOfRange_returns422() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sample/data?limit=0", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void data_nonNumericLimit_returns400() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sample/data?limit=abc", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void stats_describesWholeSeries() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sample/stats", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("years")).isEqualTo("2020 - 2025");
        assertThat((Map<String, Object>) resp.getBody().get("statistics")).containsEntry("records", 312);
    }

    @Test
    void forecast_returnsEightRoundedWeeks() {
        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/sample/forecast", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("model")).isEqualTo("ARIMA");
        List<Number> forecast = (List<Number>) resp.getBody().get("forecast");
        assertThat(forecast).hasSize(8);
        assertThat(forecast).allSatisfy(v ->
            assertThat(Decimals.round(v.doubleValue(), 2)).isEqualTo(v.doubleValue()));
        List<Map<String, Object>> weeks = (List<Map<String, Object>>) resp.getBody().get("forecastWeeks");
        assertThat(weeks.get(0)).containsEntry("year", 2026).containsEntry("week", 1);
    }
}
