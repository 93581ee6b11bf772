package io.github.chirino.checkin.api.dto;

import java.util.List;

public class BatchRequest {

    private List<Long> ids;

    public List<Long> getIds() {
        return ids;
    }

    public void setIds(List<Long> ids) {
        this.ids = ids;
    }
}
