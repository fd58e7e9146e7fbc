package net.cratedigger.controller;

import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import net.cratedigger.application.review.ActionResult;
import net.cratedigger.application.review.ReviewActionHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point for review actions such as {@code review/accept} or {@code testconnection}.
 *
 * <p>Parameters are flat request parameters. A {@link ActionResult.Failure} maps to 400;
 * every other result is returned as JSON with 200.</p>
 */
@RestController
@RequestMapping("/api/actions")
@Slf4j
public class ActionController {

    private final ReviewActionHandler actionHandler;

    public ActionController(ReviewActionHandler actionHandler) {
        this.actionHandler = actionHandler;
    }

    @PostMapping("/{group}/{name}")
    public ResponseEntity<ActionResult> groupedAction(@PathVariable("group") String group,
                                                      @PathVariable("name") String name,
                                                      @RequestParam Map<String, String> params) {
        return respond(group + "/" + name, params);
    }

    @PostMapping("/{name}")
    public ResponseEntity<ActionResult> action(@PathVariable("name") String name,
                                               @RequestParam Map<String, String> params) {
        return respond(name, params);
    }

    private ResponseEntity<ActionResult> respond(String action, Map<String, String> params) {
        ActionResult result = actionHandler.handle(action, params);
        if (result instanceof ActionResult.Failure) {
            return ResponseEntity.badRequest().body(result);
        }
        return ResponseEntity.ok(result);
    }
}
