package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.EmailRecord;
import java.util.List;

public interface EmailRepository {

    EmailRecord save(EmailRecord email);

    List<EmailRecord> findAll();
}
