package net.scanward.app.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateScanRequest(@JsonProperty("target") @JsonAlias("target_url") String target) {}
