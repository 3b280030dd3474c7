package com.vibecoding.ocloud.controller;

import com.vibecoding.ocloud.model.o2.O2Alarm;
import com.vibecoding.ocloud.model.o2.O2Subscription;
import com.vibecoding.ocloud.service.O2InterfaceService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * O2 IMS 알람 / 구독 API
 */
@RestController
@RequestMapping("/o2ims/v1")
@RequiredArgsConstructor
public class O2AlarmController {

    private static final Logger log = LoggerFactory.getLogger(O2AlarmController.class);

    private final O2InterfaceService o2Service;

    @GetMapping("/alarms")
    public List<O2Alarm> listAlarms() {
        return o2Service.listAlarms();
    }

    @GetMapping("/alarms/{id}")
    public ResponseEntity<O2Alarm> getAlarm(@PathVariable String id) {
        return ResponseEntity.of(o2Service.getAlarm(id));
    }

    /**
     * 알람 확인 처리 (없으면 404)
     */
    @PostMapping("/alarms/{id}/acknowledge")
    public Map<String, String> acknowledgeAlarm(@PathVariable String id) {
        log.info("O2: acknowledge alarm {}", id);
        o2Service.acknowledgeAlarm(id);
        return Map.of("status", "acknowledged");
    }

    @GetMapping("/subscriptions")
    public List<O2Subscription> listSubscriptions() {
        return o2Service.listSubscriptions();
    }

    @GetMapping("/subscriptions/{id}")
    public ResponseEntity<O2Subscription> getSubscription(@PathVariable String id) {
        return ResponseEntity.of(o2Service.getSubscription(id));
    }

    @PostMapping("/subscriptions")
    public ResponseEntity<O2Subscription> createSubscription(@RequestBody O2Subscription subscription) {
        return ResponseEntity.status(HttpStatus.CREATED).body(o2Service.createSubscription(subscription));
    }

    @DeleteMapping("/subscriptions/{id}")
    public ResponseEntity<Void> deleteSubscription(@PathVariable String id) {
        o2Service.deleteSubscription(id);
        return ResponseEntity.noContent().build();
    }
}
