package me.golemcore.ngchat.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.ngchat.domain.model.StateLink;
import me.golemcore.ngchat.domain.model.ToolFailureKind;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolInvocationResponse {
    private String tool;
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ToolFailureKind failureKind;
    private StateLink stateLink;
}
