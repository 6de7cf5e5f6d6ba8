package com.example.sessionguard.web.rest.controller;

import static com.example.sessionguard.web.rest.ApiConstants.ApiPath.*;
import static com.example.sessionguard.web.rest.ApiConstants.Param.*;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Tag(
    name = "Authentication",
    description = "Sign-in and sign-out for the cookie-carried session"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Sign in",
      description = "Exchanges credentials at the authentication backend and sets the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "302", description = "Redirect to the return path, or back to the login page with an error code")
  })
  @PostMapping(value = SIGN_IN, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  ResponseEntity<Void> signIn(
      @Parameter(description = "Account identifier", required = true)
      @RequestParam(value = IDENTIFIER, required = false) String identifier,
      @Parameter(description = "Account secret", required = true)
      @RequestParam(value = SECRET, required = false) String secret,
      @Parameter(description = "Local path to return to after sign-in", example = "/dashboard")
      @RequestParam(value = NEXT, required = false) String next,
      HttpServletRequest request,
      HttpServletResponse response
                             );

  @Operation(
      summary = "Sign out",
      description = "Revokes the session at the backend (best effort) and clears the session cookie"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Signed out")
  })
  @PostMapping(value = SIGN_OUT)
  ResponseEntity<Map<String, Object>> signOut(
      HttpServletRequest request,
      HttpServletResponse response
                                             );
}
