package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Read-only session inspection for server-rendered pages and scripts.
 */
@Tag(
    name = "Session",
    description = "Read-only view of the current session"
)
@RequestMapping(
    value = SESSION_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface SessionAPI {

  @Operation(
      summary = "Check session status",
      description = "Whether the current request carries a valid session"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session status returned")
  })
  @GetMapping(value = STATUS)
  ResponseEntity<Map<String, Object>> status(HttpServletRequest request);

  @Operation(
      summary = "Get session",
      description = "Returns the subject and expiry of the current session. Token material is never returned."
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Session returned"),
      @ApiResponse(responseCode = "401", description = "Not authenticated")
  })
  @GetMapping
  ResponseEntity<Map<String, Object>> current(HttpServletRequest request);
}
