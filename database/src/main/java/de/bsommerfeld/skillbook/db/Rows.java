package de.bsommerfeld.skillbook.db;

import de.bsommerfeld.skillbook.core.domain.FragmentReference;
import de.bsommerfeld.skillbook.core.domain.Plan;
import de.bsommerfeld.skillbook.core.domain.PlanStatus;
import de.bsommerfeld.skillbook.core.domain.PlanTask;
import de.bsommerfeld.skillbook.core.domain.PositionedSkill;
import de.bsommerfeld.skillbook.core.domain.Prompt;
import de.bsommerfeld.skillbook.core.domain.PromptFragment;
import de.bsommerfeld.skillbook.core.domain.PromptReference;
import de.bsommerfeld.skillbook.core.domain.ReferenceType;
import de.bsommerfeld.skillbook.core.domain.Skill;
import de.bsommerfeld.skillbook.core.domain.SkillLink;
import de.bsommerfeld.skillbook.core.domain.Task;
import de.bsommerfeld.skillbook.core.domain.TaskList;

import java.sql.ResultSet;
import java.sql.SQLException;

import static de.bsommerfeld.skillbook.db.Jdbc.instant;
import static de.bsommerfeld.skillbook.db.Jdbc.nullableInt;
import static de.bsommerfeld.skillbook.db.Jdbc.nullableLong;

/**
 * Result-set mappers, one per table. Joined queries alias the junction
 * columns as {@code link_position} and {@code linked_at}.
 */
public final class Rows {

    private Rows() {
    }

    public static Plan plan(ResultSet rs) throws SQLException {
        return new Plan(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("description"),
                rs.getString("content"),
                PlanStatus.parse(rs.getString("status")),
                rs.getString("created_by"),
                rs.getString("assigned_to"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"),
                instant(rs, "completed_at"));
    }

    public static TaskList taskList(ResultSet rs) throws SQLException {
        return new TaskList(
                rs.getLong("id"),
                rs.getLong("plan_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getInt("position"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public static Task task(ResultSet rs) throws SQLException {
        return new Task(
                rs.getLong("id"),
                rs.getLong("list_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getInt("completed") != 0,
                instant(rs, "completed_at"),
                rs.getInt("position"),
                rs.getString("assigned_to"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public static PlanTask planTask(ResultSet rs) throws SQLException {
        return new PlanTask(task(rs), rs.getString("list_name"), rs.getInt("list_position"));
    }

    public static Skill skill(ResultSet rs) throws SQLException {
        return new Skill(
                rs.getLong("id"),
                rs.getString("path"),
                rs.getString("category"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("content"),
                rs.getString("file_hash"),
                rs.getLong("size_bytes"),
                nullableInt(rs, "token_count"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public static PositionedSkill positionedSkill(ResultSet rs) throws SQLException {
        return new PositionedSkill(skill(rs), rs.getInt("link_position"), instant(rs, "linked_at"));
    }

    public static SkillLink skillLink(ResultSet rs) throws SQLException {
        return new SkillLink(
                rs.getLong("owner_id"),
                rs.getLong("skill_id"),
                rs.getInt("position"),
                instant(rs, "created_at"));
    }

    public static Prompt prompt(ResultSet rs) throws SQLException {
        return new Prompt(
                rs.getLong("id"),
                rs.getString("path"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getString("author"),
                rs.getString("description"),
                rs.getString("content"),
                rs.getString("file_hash"),
                rs.getLong("size_bytes"),
                nullableInt(rs, "token_count"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public static PromptFragment fragment(ResultSet rs) throws SQLException {
        return new PromptFragment(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getString("title"),
                rs.getString("description"),
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }

    public static PromptReference reference(ResultSet rs) throws SQLException {
        return new PromptReference(
                rs.getLong("id"),
                rs.getLong("source_prompt_id"),
                nullableLong(rs, "target_prompt_id"),
                nullableLong(rs, "target_fragment_id"),
                ReferenceType.parse(rs.getString("reference_type")),
                rs.getInt("position"),
                instant(rs, "created_at"));
    }

    public static FragmentReference fragmentReference(ResultSet rs) throws SQLException {
        return new FragmentReference(reference(rs), rs.getString("fragment_name"), rs.getString("fragment_title"));
    }
}
