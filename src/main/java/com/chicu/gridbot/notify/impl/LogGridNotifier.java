package com.chicu.gridbot.notify.impl;

import com.chicu.gridbot.notify.GridNotifier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LogGridNotifier implements GridNotifier {

    @Override
    public void send(String text) {
        log.info("📣 {}", text);
    }
}
