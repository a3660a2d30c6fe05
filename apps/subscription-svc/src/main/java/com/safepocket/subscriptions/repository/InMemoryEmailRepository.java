package com.safepocket.subscriptions.repository;

import com.safepocket.subscriptions.model.EmailRecord;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryEmailRepository implements EmailRepository {

    private final List<EmailRecord> storage = new CopyOnWriteArrayList<>();

    @Override
    public EmailRecord save(EmailRecord email) {
        storage.add(email);
        return email;
    }

    @Override
    public List<EmailRecord> findAll() {
        return List.copyOf(storage);
    }
}
