package com.rakshak.honeypot.service;

import com.rakshak.honeypot.model.AccumulatedIntelligence;
import com.rakshak.honeypot.model.ConversationSession;
import com.rakshak.honeypot.model.DetectionResult;
import com.rakshak.honeypot.model.EscalationReport;

/**
 * 情資報告升級服務介面
 * 負責判斷是否送出詐騙確認報告，且每個對話最多送出一次
 */
public interface EscalationService {

    /**
     * 符合條件時送出報告
     * <p>
     * 條件：本輪判定為詐騙、訊息數達到門檻、且本次呼叫成功將 Session 標記為已送出。
     * 報告在背景送出，送出失敗不會影響呼叫端。
     *
     * @param session   對話 Session
     * @param detection 本輪判定結果
     * @return 本次呼叫觸發了報告時為 true
     */
    boolean escalateIfEligible(ConversationSession session, DetectionResult detection);

    /**
     * 組合報告內容
     */
    EscalationReport buildReport(String sessionId, int totalMessages, AccumulatedIntelligence intelligence,
            DetectionResult detection);
}
