package com.hao.comments.controller;

import com.hao.comments.common.model.CommentThread;
import com.hao.comments.service.EnablementService;
import com.hao.comments.service.ModerationService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 评论审核管理控制器
 *
 * 类职责：
 * 提供待审核列表、人工通过、人工撤回、重新自动审核与页面开关设置接口。
 *
 * 核心实现思路：
 * - 仅在 comments.admin.enabled=true 时注册，接口不做鉴权，应只绑定在内网地址上。
 * - 业务逻辑委托给 ModerationService 与 EnablementService。
 */
@RestController
@RequestMapping("/comments/admin")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "comments.admin", name = "enabled", havingValue = "true")
public class CommentAdminController {

    private final ModerationService moderationService;

    private final EnablementService enablementService;

    @GetMapping("/pending")
    public List<Long> listPending(@RequestParam(name = "url", required = false) String url) {
        return moderationService.listPending(CommentThread.parse(url));
    }

    @PostMapping("/approve")
    public Map<String, Object> approve(@RequestParam(name = "url", required = false) String url,
                                       @RequestParam("id") long id) {
        return result(id, "approved", moderationService.approve(CommentThread.parse(url), id));
    }

    @PostMapping("/retract")
    public Map<String, Object> retract(@RequestParam(name = "url", required = false) String url,
                                       @RequestParam("id") long id) {
        return result(id, "retracted", moderationService.retract(CommentThread.parse(url), id));
    }

    /**
     * 重新自动审核，用于审核失败后的补偿
     */
    @PostMapping("/classify")
    public Map<String, Object> classify(@RequestParam(name = "url", required = false) String url,
                                        @RequestParam("id") long id) {
        return result(id, "approved", moderationService.classify(CommentThread.parse(url), id));
    }

    @PutMapping("/enabled")
    public Map<String, Object> setEnabled(@RequestParam(name = "url", required = false) String url,
                                          @RequestParam("enabled") boolean enabled) {
        CommentThread thread = CommentThread.parse(url);
        enablementService.setEnabled(thread, enabled);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("thread", thread.toString());
        body.put("enabled", enabled);
        return body;
    }

    private Map<String, Object> result(long id, String field, boolean value) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put(field, value);
        return body;
    }
}
