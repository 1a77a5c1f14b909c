package flowwatch.compute.api;

import flowwatch.baseline.HistoricalBaseline;
import flowwatch.compute.service.GaugePipelineService;
import flowwatch.config.ApiRoutes;
import flowwatch.domain.baseline.BaselineEntry;
import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.domain.exception.UnknownSiteException;
import flowwatch.domain.gauge.ProcessedDataset;
import flowwatch.domain.gauge.ProcessedRow;
import flowwatch.domain.gauge.Reading;
import flowwatch.domain.gauge.RocStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = GaugeController.class)
class GaugeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GaugePipelineService pipelineService;

    @MockBean
    private HistoricalBaseline historicalBaseline;

    private static ProcessedRow jamesRow() {
        return ProcessedRow.builder()
                .siteId("02035000")
                .siteName("JAMES RIVER AT CARTERSVILLE, VA")
                .latestTimestamp(OffsetDateTime.parse("2024-06-01T12:00:00-04:00"))
                .latestFlow(10.0)
                .pctChange1h(5.0)
                .rocStatus1h(RocStatus.OK)
                .pctChange3h(25.0)
                .rocStatus6h(RocStatus.NO_EARLIER_READING)
                .p90Flow(9.5)
                .ratio(10.0 / 9.5)
                .highFlow(true)
                .rocStatus(RocStatus.OK)
                .build();
    }

    @Test
    void getGauges_ShouldReturnRowsInSnakeCase() throws Exception {
        given(pipelineService.currentDataset()).willReturn(new ProcessedDataset(List.of(jamesRow())));

        mockMvc.perform(get(ApiRoutes.GAUGES))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].site_id").value("02035000"))
                .andExpect(jsonPath("$[0].latest_timestamp").value("2024-06-01T12:00:00-04:00"))
                .andExpect(jsonPath("$[0].pct_change_1h").value(5.0))
                .andExpect(jsonPath("$[0].roc_status_1h").value("OK"))
                .andExpect(jsonPath("$[0].pct_change_3h").value(25.0))
                .andExpect(jsonPath("$[0].roc_status_6h").value("NO_EARLIER_READING"))
                .andExpect(jsonPath("$[0].p90_flow").value(9.5))
                .andExpect(jsonPath("$[0].roc_status").value("OK"));
    }

    @Test
    void getGauges_ShouldReturnEmptyListBeforeFirstRun() throws Exception {
        given(pipelineService.currentDataset()).willReturn(ProcessedDataset.empty());

        mockMvc.perform(get(ApiRoutes.GAUGES))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void getGauge_ShouldReturn404_WhenSiteHasNoRow() throws Exception {
        given(pipelineService.currentRow("01646500")).willReturn(Optional.empty());

        mockMvc.perform(get(ApiRoutes.GAUGES + "/01646500"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void getReadings_ShouldReturnRollingWindow() throws Exception {
        given(pipelineService.readings("02035000")).willReturn(List.of(
                new Reading("02035000", OffsetDateTime.parse("2024-06-01T11:45:00-04:00"), 9.5),
                new Reading("02035000", OffsetDateTime.parse("2024-06-01T12:00:00-04:00"), null)));

        mockMvc.perform(get(ApiRoutes.GAUGES + "/02035000/readings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].site_id").value("02035000"))
                .andExpect(jsonPath("$[0].timestamp").value("2024-06-01T11:45:00-04:00"))
                .andExpect(jsonPath("$[0].flow").value(9.5))
                .andExpect(jsonPath("$[1].flow").doesNotExist());
    }

    @Test
    void getReadings_ShouldReturn404_WhenSiteNeverIngested() throws Exception {
        given(pipelineService.readings("01646500")).willThrow(new UnknownSiteException("01646500"));

        mockMvc.perform(get(ApiRoutes.GAUGES + "/01646500/readings"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void getBaseline_ShouldReturnDayOfYearPairs() throws Exception {
        HistoricalBaselineTable table = HistoricalBaselineTable.builder()
                .siteId("02035000")
                .computedAt(Instant.parse("2024-06-01T00:00:00Z"))
                .sampleYears(2)
                .entries(List.of(new BaselineEntry(1, 120.0), new BaselineEntry(153, 9.5)))
                .build();
        given(historicalBaseline.find("02035000")).willReturn(Optional.of(table));

        mockMvc.perform(get(ApiRoutes.GAUGES + "/02035000/baseline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].day_of_year").value(153))
                .andExpect(jsonPath("$[1].p90_flow").value(9.5));
    }

    @Test
    void getBaseline_ShouldReturn404_WhenAbsent() throws Exception {
        given(historicalBaseline.find("02035000")).willReturn(Optional.empty());

        mockMvc.perform(get(ApiRoutes.GAUGES + "/02035000/baseline"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getBaseline_ShouldReturn400_WhenSiteIdIsInvalid() throws Exception {
        given(historicalBaseline.find("abc")).willThrow(new IllegalArgumentException("Invalid site id: abc"));

        mockMvc.perform(get(ApiRoutes.GAUGES + "/abc/baseline"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid site id: abc"));
    }

    @Test
    void deleteBaseline_ShouldReturn204_WhenDeleted() throws Exception {
        given(historicalBaseline.invalidate("02035000")).willReturn(true);

        mockMvc.perform(delete(ApiRoutes.GAUGES + "/02035000/baseline"))
                .andExpect(status().isNoContent());

        verify(historicalBaseline).invalidate("02035000");
    }

    @Test
    void deleteBaseline_ShouldReturn404_WhenNothingStored() throws Exception {
        given(historicalBaseline.invalidate("02035000")).willReturn(false);

        mockMvc.perform(delete(ApiRoutes.GAUGES + "/02035000/baseline"))
                .andExpect(status().isNotFound());
    }
}
