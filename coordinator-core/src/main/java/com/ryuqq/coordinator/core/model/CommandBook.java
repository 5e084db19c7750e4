package com.ryuqq.coordinator.core.model;

import java.util.List;

/**
 * 함께 제출되는 하나 이상의 순서 있는 command page 묶음.
 *
 * <p>CommandBook은 호출자 소유이며 coordinator는 읽기만 합니다 (변경하지 않음).
 * 첫 번째 page가 primary command입니다.</p>
 *
 * @param cover 대상 aggregate
 * @param pages command page 목록 (비어 있으면 안 됨)
 * @param origin saga/process manager 출처 (선택, null 가능)
 *
 * @author Coordinator Team
 * @since 1.0.0
 */
public record CommandBook(
    Cover cover,
    List<CommandPage> pages,
    CommandOrigin origin
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cover가 null이거나 pages가 비어 있는 경우
     */
    public CommandBook {
        if (cover == null) {
            throw new IllegalArgumentException("cover cannot be null");
        }
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("CommandBook must have at least one page");
        }
        pages = List.copyOf(pages);
    }

    /**
     * 단일 page CommandBook 생성.
     *
     * @param cover 대상 aggregate
     * @param page command page
     * @return CommandBook 인스턴스
     */
    public static CommandBook of(Cover cover, CommandPage page) {
        return new CommandBook(cover, List.of(page), null);
    }

    /**
     * Primary command page 조회.
     *
     * @return 첫 번째 page
     */
    public CommandPage primaryPage() {
        return pages.get(0);
    }

    /**
     * Cover만 변경한 새 인스턴스 생성.
     *
     * @param cover 새 cover
     * @return 새 CommandBook 인스턴스
     */
    public CommandBook withCover(Cover cover) {
        return new CommandBook(cover, pages, origin);
    }

    /**
     * 출처만 변경한 새 인스턴스 생성.
     *
     * @param origin 새 출처
     * @return 새 CommandBook 인스턴스
     */
    public CommandBook withOrigin(CommandOrigin origin) {
        return new CommandBook(cover, pages, origin);
    }
}
