package com.kmg.repost.api;

import com.kmg.repost.dto.CreateScheduleRequest;
import com.kmg.repost.dto.CreateScheduleResponse;
import com.kmg.repost.dto.RunNowResponse;
import com.kmg.repost.dto.ScheduleView;
import com.kmg.repost.dto.ToggleResponse;
import com.kmg.repost.service.ScheduleService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {
    private final ScheduleService scheduleService;

    public ScheduleController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping
    public List<ScheduleView> list() {
        return scheduleService.list();
    }

    @PostMapping
    public CreateScheduleResponse create(@Valid @RequestBody CreateScheduleRequest request) {
        return new CreateScheduleResponse(scheduleService.create(request));
    }

    @GetMapping("/{id}")
    public ScheduleView get(@PathVariable String id) {
        return scheduleService.get(id);
    }

    @PostMapping("/{id}/repost-now")
    public RunNowResponse repostNow(@PathVariable String id) {
        return scheduleService.runNow(id);
    }

    @PostMapping("/{id}/toggle")
    public ToggleResponse toggle(@PathVariable String id) {
        return scheduleService.toggle(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        scheduleService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
