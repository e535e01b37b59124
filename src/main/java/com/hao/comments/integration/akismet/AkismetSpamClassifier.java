package com.hao.comments.integration.akismet;

import com.hao.comments.common.exception.ClassifierProtocolException;
import com.hao.comments.common.exception.ClassifierUnavailableException;
import com.hao.comments.common.util.BooleanLiterals;
import com.hao.comments.config.CommentsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Akismet 反垃圾分类器
 *
 * 类职责：
 * 通过 Akismet REST 接口完成 comment-check、submit-ham、submit-spam 调用。
 *
 * 核心实现思路：
 * - 评论哈希字段加上固定的 blog 站点标识，以表单方式 POST。
 * - comment-check 的响应体必须是布尔字面量，true 表示垃圾评论。
 * - submit-ham / submit-spam 的响应体只记录日志。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AkismetSpamClassifier implements SpamClassifier {

    static final String COMMENT_CHECK = "comment-check";
    static final String SUBMIT_HAM = "submit-ham";
    static final String SUBMIT_SPAM = "submit-spam";

    private final RestTemplate restTemplate;

    private final CommentsProperties properties;

    @Override
    public boolean isEnabled() {
        return StringUtils.hasText(properties.getAkismet().getApiKey());
    }

    /**
     * 判定评论是否为垃圾评论
     *
     * 实现逻辑：
     * 1. POST comment-check。
     * 2. 响应体按布尔字面量解析，无法解析时抛出协议异常。
     */
    @Override
    public boolean isSpam(Map<String, String> commentFields) {
        String body = post(COMMENT_CHECK, commentFields);
        return BooleanLiterals.parse(body)
                .orElseThrow(() -> new ClassifierProtocolException("unexpected return value from akismet: " + body));
    }

    @Override
    public void submitHam(Map<String, String> commentFields) {
        String body = post(SUBMIT_HAM, commentFields);
        log.info("Akismet误判回报完成|Akismet_submit_ham_done,permalink={},reply={}",
                commentFields.get("permalink"), body);
    }

    @Override
    public void submitSpam(Map<String, String> commentFields) {
        String body = post(SUBMIT_SPAM, commentFields);
        log.info("Akismet漏判回报完成|Akismet_submit_spam_done,permalink={},reply={}",
                commentFields.get("permalink"), body);
    }

    /**
     * 以表单方式调用 Akismet 接口
     *
     * @param action 接口名
     * @param commentFields 评论哈希字段
     * @return 响应体，可能为 null
     */
    private String post(String action, Map<String, String> commentFields) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("blog", properties.getSiteUrl());
        commentFields.forEach(form::add);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        String url = String.format(properties.getAkismet().getEndpointTemplate(),
                properties.getAkismet().getApiKey(), action);
        try {
            return restTemplate.postForObject(url, new HttpEntity<>(form, headers), String.class);
        } catch (RestClientException e) {
            throw new ClassifierUnavailableException("akismet " + action + " failed", e);
        }
    }
}
