package com.ospicorp.planningcube.dimension.repository;

import com.ospicorp.planningcube.dimension.model.Dimension;
import com.ospicorp.planningcube.dimension.model.Member;
import com.ospicorp.planningcube.dimension.model.enums.DimensionType;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "planning.cube.store", havingValue = "jdbc")
public class JdbcDimensionRepository implements DimensionRepository {
  private static final RowMapper<Dimension> DIMENSION_ROW = (rs, i) -> new Dimension(
      rs.getString("id"),
      rs.getString("scope_id"),
      DimensionType.valueOf(rs.getString("type")),
      rs.getString("name"),
      rs.getInt("display_order"));

  private static final RowMapper<Member> MEMBER_ROW = (rs, i) -> new Member(
      rs.getString("id"),
      rs.getString("dimension_id"),
      rs.getString("name"),
      rs.getString("code"),
      rs.getString("parent_id"));

  private final JdbcTemplate jdbc;

  public JdbcDimensionRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Optional<Dimension> findDimension(String dimensionId) {
    return jdbc.query("""
        SELECT id, scope_id, type, name, display_order
        FROM cube_dimension
        WHERE id = ?
        """, DIMENSION_ROW, dimensionId).stream().findFirst();
  }

  @Override
  public Optional<Dimension> findDimension(String scopeId, DimensionType type) {
    return jdbc.query("""
        SELECT id, scope_id, type, name, display_order
        FROM cube_dimension
        WHERE scope_id = ? AND type = ?
        """, DIMENSION_ROW, scopeId, type.name()).stream().findFirst();
  }

  @Override
  public List<Dimension> findDimensions(String scopeId) {
    return jdbc.query("""
        SELECT id, scope_id, type, name, display_order
        FROM cube_dimension
        WHERE scope_id = ?
        ORDER BY display_order, type
        """, DIMENSION_ROW, scopeId);
  }

  @Override
  public Dimension insertDimensionIfAbsent(Dimension dimension) {
    jdbc.update("""
        INSERT INTO cube_dimension (id, scope_id, type, name, display_order)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (scope_id, type) DO NOTHING
        """,
        dimension.id(), dimension.scopeId(), dimension.type().name(), dimension.name(),
        dimension.displayOrder());
    return findDimension(dimension.scopeId(), dimension.type())
        .orElseThrow(() -> new IllegalStateException(
            "Dimension " + dimension.type() + " missing after insert for scope "
                + dimension.scopeId()));
  }

  @Override
  public Optional<Member> findMember(String memberId) {
    return jdbc.query("""
        SELECT id, dimension_id, name, code, parent_id
        FROM cube_member
        WHERE id = ?
        """, MEMBER_ROW, memberId).stream().findFirst();
  }

  @Override
  public List<Member> findMembers(String dimensionId) {
    return jdbc.query("""
        SELECT id, dimension_id, name, code, parent_id
        FROM cube_member
        WHERE dimension_id = ?
        ORDER BY seq
        """, MEMBER_ROW, dimensionId);
  }

  @Override
  public void insertMember(Member member) {
    jdbc.update("""
        INSERT INTO cube_member (id, dimension_id, name, code, parent_id)
        VALUES (?, ?, ?, ?, ?)
        """,
        member.id(), member.dimensionId(), member.name(), member.code(), member.parentId());
  }

  @Override
  public void updateMember(Member member) {
    jdbc.update("""
        UPDATE cube_member
        SET name = ?, code = ?, parent_id = ?
        WHERE id = ?
        """,
        member.name(), member.code(), member.parentId(), member.id());
  }

  @Override
  public boolean deleteMember(String memberId) {
    return jdbc.update("DELETE FROM cube_member WHERE id = ?", memberId) > 0;
  }
}
