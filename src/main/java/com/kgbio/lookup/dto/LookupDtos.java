package com.kgbio.lookup.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kgbio.lookup.model.Bio;
import com.kgbio.lookup.model.LookupOutcome;
import com.kgbio.lookup.model.SparqlRow;
import jakarta.validation.constraints.NotBlank;

public class LookupDtos {
    public static class LookupRequestBody {
        @NotBlank
        private String entity; // e.g. "Hertha BSC"
        @NotBlank
        private String property; // e.g. "head coach"
        private Integer year; // null = current year
        private String language;

        public String getEntity() { return entity; }
        public void setEntity(String entity) { this.entity = entity; }
        public String getProperty() { return property; }
        public void setProperty(String property) { this.property = property; }
        public Integer getYear() { return year; }
        public void setYear(Integer year) { this.year = year; }
        public String getLanguage() { return language; }
        public void setLanguage(String language) { this.language = language; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class LookupResponseBody {
        private String status;
        private String reason;
        private Bio bio;
        private SparqlRow statement;

        public static LookupResponseBody from(LookupOutcome outcome) {
            LookupResponseBody body = new LookupResponseBody();
            if (outcome.isFound()) {
                body.status = "found";
                body.bio = outcome.getBio();
                body.statement = outcome.getStatement();
            } else {
                body.status = "not_found";
                body.reason = outcome.getReason().key();
            }
            return body;
        }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
        public String getReason() { return reason; }
        public void setReason(String reason) { this.reason = reason; }
        public Bio getBio() { return bio; }
        public void setBio(Bio bio) { this.bio = bio; }
        public SparqlRow getStatement() { return statement; }
        public void setStatement(SparqlRow statement) { this.statement = statement; }
    }
}
