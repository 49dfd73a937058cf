/*
 * Copyright (C) 2025 The Polity Hierarchy Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.polity.hierarchy.engine.repository;

import com.polity.hierarchy.common.domain.node.HierarchyNode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;

/**
 * Bulk range updates are native statements scoped to a single tree. They clear the persistence context, so entities
 * loaded before one of them must be reloaded.
 */
public interface HierarchyNodeRepository extends CrudRepository<HierarchyNode, Long> {

    @Query(value = "select scope_id from hierarchy_node where id = ?1", nativeQuery = true)
    Optional<Long> findScopeIdById(long id);

    @Query(value = "select right_bound from hierarchy_node where id = ?1", nativeQuery = true)
    Optional<Long> findRightBound(long id);

    Optional<HierarchyNode> findByScopeIdAndParentIdIsNull(long scopeId);

    List<HierarchyNode> findByScopeIdOrderByLeftBound(long scopeId);

    List<HierarchyNode> findByScopeIdAndLeftBoundBetweenOrderByLeftBound(long scopeId, long left, long right);

    List<HierarchyNode> findByParentIdOrderByLeftBound(long parentId);

    boolean existsByParentIdAndCode(long parentId, String code);

    long countByParentIdAndUnitTypeAndActiveTrue(long parentId, String unitType);

    @Query(
            value =
                    """
            select a.* from hierarchy_node n
            join hierarchy_node a on a.scope_id = n.scope_id and a.left_bound < n.left_bound
              and a.right_bound > n.right_bound
            where n.id = ?1
            order by a.left_bound""",
            nativeQuery = true)
    List<HierarchyNode> findAncestors(long id);

    @Query(
            value =
                    """
            select d.* from hierarchy_node n
            join hierarchy_node d on d.scope_id = n.scope_id and d.left_bound > n.left_bound
              and d.right_bound < n.right_bound
            where n.id = ?1
            order by d.left_bound""",
            nativeQuery = true)
    List<HierarchyNode> findDescendants(long id);

    @Query(
            value =
                    """
            select d.* from hierarchy_node n
            join hierarchy_node d on d.scope_id = n.scope_id and d.left_bound > n.left_bound
              and d.right_bound < n.right_bound
            where n.id = ?1 and d.depth - n.depth <= ?2
            order by d.left_bound""",
            nativeQuery = true)
    List<HierarchyNode> findDescendants(long id, int maxDepth);

    @Query(
            value =
                    """
            select * from hierarchy_node
            where scope_id = ?1 and unit_level = ?2 and active = true
            order by active_count desc, total_count desc, id asc
            limit ?3""",
            nativeQuery = true)
    List<HierarchyNode> findLeaderboard(long scopeId, int unitLevel, int limit);

    @Query(
            value =
                    """
            select count(*) from hierarchy_node
            where scope_id = ?1 and left_bound <= ?2 and right_bound >= ?3""",
            nativeQuery = true)
    long countChain(long scopeId, long left, long right);

    // Rows that would go negative are left out, so a short row count means an underflow on the chain

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set total_count = total_count + :total, active_count = active_count + :active,
              modified_timestamp = :now
            where scope_id = :scopeId and left_bound <= :left and right_bound >= :right
              and total_count + :total >= 0 and active_count + :active >= 0""",
            nativeQuery = true)
    int applyDelta(
            @Param("scopeId") long scopeId,
            @Param("left") long left,
            @Param("right") long right,
            @Param("total") long totalDelta,
            @Param("active") long activeDelta,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value = "update hierarchy_node set left_bound = left_bound + ?3 where scope_id = ?1 and left_bound >= ?2",
            nativeQuery = true)
    int shiftLeftBounds(long scopeId, long from, long delta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set right_bound = right_bound + ?3
            where scope_id = ?1 and right_bound >= ?2""",
            nativeQuery = true)
    int shiftRightBounds(long scopeId, long from, long delta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set left_bound = -left_bound, right_bound = -right_bound
            where scope_id = ?1 and left_bound >= ?2 and right_bound <= ?3""",
            nativeQuery = true)
    int detachSubtree(long scopeId, long left, long right);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set left_bound = -left_bound + ?2, right_bound = -right_bound + ?2,
              depth = depth + ?3
            where scope_id = ?1 and left_bound < 0""",
            nativeQuery = true)
    int attachSubtree(long scopeId, long offset, int depthDelta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set valid_from = least(valid_from, :at), valid_to = :at, modified_timestamp = :now
            where scope_id = :scopeId and left_bound >= :left and right_bound <= :right
              and (valid_to is null or valid_to > :at)""",
            nativeQuery = true)
    int closeWindows(
            @Param("scopeId") long scopeId,
            @Param("left") long left,
            @Param("right") long right,
            @Param("at") Instant at,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set active = false, modified_timestamp = ?4
            where scope_id = ?1 and left_bound >= ?2 and right_bound <= ?3 and active = true""",
            nativeQuery = true)
    int deactivateSubtree(long scopeId, long left, long right, Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set total_count = :total, active_count = :active, modified_timestamp = :now
            where id = :id and total_count = :observedTotal and active_count = :observedActive""",
            nativeQuery = true)
    int updateCounters(
            @Param("id") long id,
            @Param("observedTotal") long observedTotal,
            @Param("observedActive") long observedActive,
            @Param("total") long total,
            @Param("active") long active,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            value =
                    """
            update hierarchy_node set path = :path, depth = :depth, modified_timestamp = :now
            where id = :id and path = :observedPath and depth = :observedDepth""",
            nativeQuery = true)
    int updatePath(
            @Param("id") long id,
            @Param("observedPath") String observedPath,
            @Param("observedDepth") int observedDepth,
            @Param("path") String path,
            @Param("depth") int depth,
            @Param("now") Instant now);
}
