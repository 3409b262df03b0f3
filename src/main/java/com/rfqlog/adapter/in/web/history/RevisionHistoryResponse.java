package com.rfqlog.adapter.in.web.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Revision history DTO - date → actor → change tree of one part
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RevisionHistoryResponse {
    // API response fields
    private String status;  // success, error
    private String message;

    private Long entityId;
    private String timeZone;
    private Integer totalChanges;
    private List<DateView> dates;

    public static RevisionHistoryResponse error(String message) {
        return RevisionHistoryResponse.builder()
                .status("error")
                .message(message)
                .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DateView {
        private String date;
        private List<ActorView> actors;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ActorView {
        private String actor;
        private List<ChangeView> changes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChangeView {
        private Long id;
        private String field;
        private String label;
        private String changeKind;
        private String oldValue;
        private String newValue;
        private String displayOld;
        private String displayNew;
        private String changedAt;
        private String time;
        private String notes;
    }
}
