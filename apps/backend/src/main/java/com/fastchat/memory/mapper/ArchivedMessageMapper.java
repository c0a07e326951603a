package com.fastchat.memory.mapper;

import com.fastchat.memory.service.impl.entity.ArchivedMessageEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ArchivedMessageMapper {

    int upsertMessage(@Param("e") ArchivedMessageEntity entity);

    List<ArchivedMessageEntity> selectMessages(@Param("sessionId") String sessionId,
                                               @Param("branchId") String branchId,
                                               @Param("mainOnly") boolean mainOnly,
                                               @Param("role") String role,
                                               @Param("since") Long since,
                                               @Param("newestFirst") boolean newestFirst,
                                               @Param("offset") long offset,
                                               @Param("limit") int limit);

    int deleteBySession(@Param("sessionId") String sessionId);
}
