package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.entry.CronType;

/**
 * Identity of a live job: the owning entry's type and id. Scan and report ids never collide.
 */
public record JobKey(CronType type, String id) {

    @Override
    public String toString() {
        return type.name().toLowerCase() + "/" + id;
    }
}
