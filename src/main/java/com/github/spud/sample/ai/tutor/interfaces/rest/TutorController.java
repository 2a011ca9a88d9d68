package com.github.spud.sample.ai.tutor.interfaces.rest;

import com.github.spud.sample.ai.tutor.domain.session.CreateSessionResult;
import com.github.spud.sample.ai.tutor.domain.session.SessionStateView;
import com.github.spud.sample.ai.tutor.domain.session.TrajectoryView;
import com.github.spud.sample.ai.tutor.domain.session.TurnResult;
import com.github.spud.sample.ai.tutor.domain.session.TutorSessionService;
import com.github.spud.sample.ai.tutor.domain.summary.SessionSummary;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Socratic Tutor Api
 * <p>
 * 会话引擎是阻塞调用（模型、数据库），统一切换到 boundedElastic 执行；异常交给 {@link GlobalExceptionHandler}。
 */
@Slf4j
@RestController
@RequestMapping("/tutor/sessions")
@RequiredArgsConstructor
public class TutorController {

  private final TutorSessionService sessionService;

  /**
   * 为模块发起一个新的辅导会话
   */
  @PostMapping
  public Mono<ResponseEntity<CreateSessionResult>> createSession(
    @Valid @RequestBody CreateSessionRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Creating tutor session: moduleId={}, modelOverride={}", request.getModuleId(),
          request.getModelOverride());
        return ResponseEntity.ok(
          sessionService.createSession(request.getModuleId(), request.getModelOverride()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 提交学习者的回答
   */
  @PostMapping("/{sessionId}/respond")
  public Mono<ResponseEntity<TurnResult>> respond(
    @PathVariable String sessionId,
    @Valid @RequestBody RespondRequestDto request
  ) {
    return Mono.fromCallable(() -> {
        log.info("Responding to sessionId={}, message length={}", sessionId,
          request.getMessage().length());
        return ResponseEntity.ok(sessionService.respond(sessionId, request.getMessage()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}")
  public Mono<ResponseEntity<SessionStateView>> getState(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionService.getState(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}/trajectory")
  public Mono<ResponseEntity<TrajectoryView>> getTrajectory(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionService.getTrajectory(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{sessionId}/summary")
  public Mono<ResponseEntity<SessionSummary>> getSummary(@PathVariable String sessionId) {
    return Mono.fromCallable(() -> ResponseEntity.ok(sessionService.getSummary(sessionId)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  // ===== DTOs =====

  @Data
  public static class CreateSessionRequestDto {

    @NotBlank
    private String moduleId;
    private String modelOverride;
  }

  @Data
  public static class RespondRequestDto {

    @NotNull
    private String message;
  }
}
