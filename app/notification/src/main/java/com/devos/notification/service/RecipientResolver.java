package com.devos.notification.service;

import com.devos.notification.model.Recipient;
import com.devos.notification.model.RecipientScope;
import com.devos.notification.repository.WorkspaceMembershipRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** イベントの対象範囲 (ユーザー/ワークスペース/プロジェクト) を受信者の一覧へ展開する。 */
@Service
@RequiredArgsConstructor
public class RecipientResolver {

  private final WorkspaceMembershipRepository membershipRepository;

  public List<Recipient> resolve(RecipientScope scope) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(scope.kind(), "scope.kind");
    final List<String> userIds =
        switch (scope.kind()) {
          case USER -> scope.userId() == null ? List.of() : List.of(scope.userId());
          case WORKSPACE -> membershipRepository.findWorkspaceMemberIds(scope.workspaceId());
          case PROJECT ->
              membershipRepository.findProjectMemberIds(scope.projectId(), scope.workspaceId());
        };
    final Set<String> distinct = new LinkedHashSet<>(userIds);
    final List<Recipient> recipients = new ArrayList<>(distinct.size());
    for (String userId : distinct) {
      recipients.add(new Recipient(userId, scope.workspaceId()));
    }
    return recipients;
  }
}
