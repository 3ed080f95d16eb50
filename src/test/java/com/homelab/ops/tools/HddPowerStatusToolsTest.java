package com.homelab.ops.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.homelab.ops.disk.HddPowerStatusService;
import com.homelab.ops.disk.ToolFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HddPowerStatusToolsTest {

    private HddPowerStatusService service;
    private HddPowerStatusTools tools;

    @BeforeEach
    void setup() {
        service = mock(HddPowerStatusService.class);
        tools = new HddPowerStatusTools();
        tools.powerStatus = service;
    }

    @Test
    void returnsReport() {
        when(service.getHddPowerStatus("12h", "backup")).thenReturn("HDD Power Status:");

        assertThat(tools.hddPowerStatus("12h", "backup")).isEqualTo("HDD Power Status:");
    }

    @Test
    void blankArgumentsUseDefaults() {
        when(service.getHddPowerStatus("24h", null)).thenReturn("report");

        assertThat(tools.hddPowerStatus("", " ")).isEqualTo("report");
        verify(service).getHddPowerStatus("24h", null);
    }

    @Test
    void toolFailureIsReturnedAsText() {
        when(service.getHddPowerStatus("24h", null)).thenThrow(ToolFailureException.backend(
            "No disk_power_state metrics found. Check that disk-status-exporter is running on TrueNAS.", null));

        assertThat(tools.hddPowerStatus(null, null))
            .isEqualTo("Error: No disk_power_state metrics found. "
                + "Check that disk-status-exporter is running on TrueNAS.");
    }

    @Test
    void unexpectedFailureIsReturnedAsText() {
        when(service.getHddPowerStatus("1w", null)).thenThrow(new IllegalStateException("boom"));

        assertThat(tools.hddPowerStatus("1w", null)).isEqualTo("Error retrieving HDD power status: boom");
    }
}
