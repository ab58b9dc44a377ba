package com.precojusto.cronbatch.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.precojusto.cronbatch.config.ClockConfig;
import com.precojusto.cronbatch.controller.dto.EnqueueRequest;
import com.precojusto.cronbatch.domain.ItemStatus;
import com.precojusto.cronbatch.domain.JobType;
import com.precojusto.cronbatch.domain.PriorityClass;
import com.precojusto.cronbatch.domain.WorkItem;
import com.precojusto.cronbatch.exception.InvalidStateTransitionException;
import com.precojusto.cronbatch.exception.WorkItemNotFoundException;
import com.precojusto.cronbatch.pipeline.CheckpointCodec;
import com.precojusto.cronbatch.service.EnqueueResult;
import com.precojusto.cronbatch.service.WorkItemService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.HashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkItemController.class)
@Import({ClockConfig.class, CheckpointCodec.class})
class WorkItemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private WorkItemService workItemService;

    @Test
    void testEnqueue_Success() throws Exception {
        // Arrange
        EnqueueRequest request = createValidRequest();
        when(workItemService.enqueue(eq(JobType.AI_REPORT), eq("report-42-PRICE_VARIATION"),
                eq(PriorityClass.PREMIUM), argThat(json -> json.contains("\"ticker\":\"PETR4\""))))
                .thenReturn(new EnqueueResult(item(7L, ItemStatus.PENDING), false));

        // Act & Assert
        mockMvc.perform(post("/api/work-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.itemId").value(7))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.isExisting").value(false))
                .andExpect(jsonPath("$.message").value("Work item queued"));
    }

    @Test
    void testEnqueue_ActiveItemExists_ReturnsIt() throws Exception {
        // Arrange
        EnqueueRequest request = createValidRequest();
        when(workItemService.enqueue(any(), any(), any(), any()))
                .thenReturn(new EnqueueResult(item(5L, ItemStatus.PROCESSING), true));

        // Act & Assert
        mockMvc.perform(post("/api/work-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.itemId").value(5))
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.isExisting").value(true))
                .andExpect(jsonPath("$.message").value("Work already queued for report-42-PRICE_VARIATION"));
    }

    @Test
    void testEnqueue_MissingTargetKey() throws Exception {
        // Arrange
        EnqueueRequest request = createValidRequest();
        request.setTargetKey("");

        // Act & Assert
        mockMvc.perform(post("/api/work-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.fieldErrors.targetKey").value("Target key is required"));

        verifyNoInteractions(workItemService);
    }

    @Test
    void testEnqueue_UnknownJobType() throws Exception {
        // Arrange
        EnqueueRequest request = createValidRequest();
        request.setJobType("weekly-digest");

        // Act & Assert
        mockMvc.perform(post("/api/work-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_JOB"));
    }

    @Test
    void testEnqueue_MalformedBody() throws Exception {
        // Act & Assert
        mockMvc.perform(post("/api/work-items")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobType\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void testGet_NotFound() throws Exception {
        // Arrange
        when(workItemService.get(99L)).thenThrow(new WorkItemNotFoundException(99L));

        // Act & Assert
        mockMvc.perform(get("/api/work-items/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void testGet_Success() throws Exception {
        // Arrange
        when(workItemService.get(7L)).thenReturn(item(7L, ItemStatus.COMPLETED));

        // Act & Assert
        mockMvc.perform(get("/api/work-items/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.jobType").value("ai-report"))
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void testReset_ItemNotFailed_Returns409() throws Exception {
        // Arrange
        when(workItemService.reset(7L))
                .thenThrow(new InvalidStateTransitionException(7L, ItemStatus.COMPLETED, ItemStatus.PENDING));

        // Act & Assert
        mockMvc.perform(post("/api/work-items/7/reset"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATE_TRANSITION"));
    }

    @Test
    void testReset_Success() throws Exception {
        // Arrange
        when(workItemService.reset(7L)).thenReturn(item(7L, ItemStatus.PENDING));

        // Act & Assert
        mockMvc.perform(post("/api/work-items/7/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.retryCount").value(0));
    }

    private EnqueueRequest createValidRequest() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("companyId", 42);
        payload.put("ticker", "PETR4");
        payload.put("reportType", "PRICE_VARIATION");

        return EnqueueRequest.builder()
                .jobType("ai-report")
                .targetKey("report-42-PRICE_VARIATION")
                .priority(PriorityClass.PREMIUM)
                .payload(payload)
                .build();
    }

    private WorkItem item(Long id, ItemStatus status) {
        return WorkItem.builder()
                .id(id)
                .jobType(JobType.AI_REPORT)
                .targetKey("report-42-PRICE_VARIATION")
                .priority(PriorityClass.PREMIUM)
                .payloadJson("{}")
                .status(status)
                .build();
    }
}
