package dev.asclepius.api;

import dev.asclepius.agent.AgentLoopService;
import dev.asclepius.agent.AgentResponse;
import jakarta.validation.Valid;
import org.springframework.context.annotation.Profile;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST entry point to the agent loop, active in the {@code web} profile. */
@RestController
@RequestMapping("/api/agent")
@Profile("web")
public class AgentController {

  private final AgentLoopService agentLoopService;

  public AgentController(AgentLoopService agentLoopService) {
    this.agentLoopService = agentLoopService;
  }

  @PostMapping("/ask")
  public AgentResponse ask(@Valid @RequestBody AskRequest request) {
    return agentLoopService.ask(request.question());
  }
}
