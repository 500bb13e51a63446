package com.devos.notification.repository;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** 受信者解決用の読み取り専用メンバーシップ参照。 */
@Repository
@RequiredArgsConstructor
public class WorkspaceMembershipRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<String> findWorkspaceMemberIds(String workspaceId) {
    final String sql =
        """
        SELECT user_id
        FROM workspace_members
        WHERE workspace_id = :workspaceId
        ORDER BY user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("workspaceId", workspaceId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  public List<String> findProjectMemberIds(String projectId, String workspaceId) {
    final String sql =
        """
        SELECT user_id
        FROM project_members
        WHERE project_id = :projectId
          AND workspace_id = :workspaceId
        ORDER BY user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("projectId", projectId)
            .addValue("workspaceId", workspaceId);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }
}
