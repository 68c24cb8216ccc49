package com.example.spontaneous.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastPage {
    private List<BroadcastResponse> items;
    private long total;
    private int page;
    private int pageSize;
}
