package com.rakshak.honeypot.service;

import com.rakshak.honeypot.model.EscalationReport;

/**
 * 情資報告外送介面
 */
public interface ReportSender {

    /**
     * 送出報告（單次嘗試，不重試）
     *
     * @param report 報告內容
     * @return 收集端回應 2xx 時為 true；逾時、無法連線或非 2xx 時為 false
     */
    boolean send(EscalationReport report);
}
